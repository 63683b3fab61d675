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

import namer.core.definition.ResourceDefinition;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Removes characters a resource type does not allow, and checks names against the pattern a resource type requires.
 */
public class ResourceNameCleaner {

    private ResourceNameCleaner() {
        // Prevents instantiation
    }

    /**
     * Removes every character matched by the clean pattern of a resource type.
     *
     * @param  input      the string to clean
     * @param  definition the resource type, or null to leave the input unchanged
     * @return            the cleaned string
     */
    public static String clean(String input, ResourceDefinition definition) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        if (definition == null) {
            return input;
        }
        return definition.getCleanPattern()
                .map(pattern -> pattern.matcher(input).replaceAll(""))
                .orElse(input);
    }

    /**
     * Cleans each string in a list. No element is dropped, even if it is left empty.
     *
     * @param  inputs     the strings to clean
     * @param  definition the resource type, or null to leave the input unchanged
     * @return            the cleaned strings, in the same order
     */
    public static List<String> cleanAll(List<String> inputs, ResourceDefinition definition) {
        return inputs.stream()
                .map(input -> clean(input, definition))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Checks whether a candidate name matches the validation pattern of a resource type in full. A resource type with
     * no validation pattern accepts no names.
     *
     * @param  candidate  the candidate name
     * @param  definition the resource type
     * @return            true if the name is acceptable
     */
    public static boolean matches(String candidate, ResourceDefinition definition) {
        if (candidate == null) {
            return false;
        }
        return definition.getValidationPattern()
                .map(pattern -> pattern.matcher(candidate).matches())
                .orElse(false);
    }
}
