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

import namer.core.definition.ResourceDefinitions;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Checks that requested resource types exist in the catalog before any names are generated.
 */
public class ResourceTypeValidator {

    private final ResourceDefinitions definitions;

    public ResourceTypeValidator(ResourceDefinitions definitions) {
        this.definitions = Objects.requireNonNull(definitions, "definitions must not be null");
    }

    /**
     * Checks a resource type and a list of resource types. Empty identifiers are ignored, but at least one of the two
     * must be set.
     *
     * @param  resourceType                    a single resource type, or null or empty if not set
     * @param  resourceTypes                   a list of resource types, or null or empty if not set
     * @throws NoResourceTypeSelectedException if neither a resource type nor a list of resource types was set
     * @throws ResourceTypesInvalidException   if any of the resource types are not in the catalog
     */
    public void validate(String resourceType, List<String> resourceTypes) {
        Set<String> identifiers = new LinkedHashSet<>();
        if (resourceType != null && !resourceType.isEmpty()) {
            identifiers.add(resourceType);
        }
        boolean noList = resourceTypes == null || resourceTypes.isEmpty();
        if (identifiers.isEmpty() && noList) {
            throw new NoResourceTypeSelectedException();
        }
        if (!noList) {
            resourceTypes.stream()
                    .filter(type -> type != null && !type.isEmpty())
                    .forEach(identifiers::add);
        }
        List<String> invalid = new ArrayList<>();
        for (String identifier : identifiers) {
            if (!definitions.contains(identifier)) {
                invalid.add(identifier);
            }
        }
        if (!invalid.isEmpty()) {
            throw new ResourceTypesInvalidException(invalid);
        }
    }
}
