/*
 * Copyright 2022-2025 Crown Copyright
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package namer.core.name;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when one or more requested resource types are not in the catalog. Reports every invalid resource type at
 * once.
 */
public class ResourceTypesInvalidException extends IllegalArgumentException {

    private final transient List<String> invalidResourceTypes;

    public ResourceTypesInvalidException(List<String> invalidResourceTypes) {
        super(buildMessage(invalidResourceTypes));
        this.invalidResourceTypes = List.copyOf(invalidResourceTypes);
    }

    private static String buildMessage(List<String> invalidResourceTypes) {
        String types = invalidResourceTypes.stream()
                .map(type -> "\"" + type + "\"")
                .collect(Collectors.joining(", "));
        if (invalidResourceTypes.size() == 1) {
            return "Invalid resource type " + types;
        }
        return "Found " + invalidResourceTypes.size() + " invalid resource types: " + types;
    }

    public List<String> getInvalidResourceTypes() {
        return invalidResourceTypes;
    }
}
