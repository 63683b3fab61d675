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
import namer.core.definition.ResourceDefinitions;
import namer.core.definition.ResourceTypeNotFoundException;

import java.util.Locale;
import java.util.Objects;

/**
 * Checks a name chosen by the caller against the constraints of a resource type, without generating anything.
 */
public class ResourceNameValidator {

    private final ResourceDefinitions definitions;

    public ResourceNameValidator(ResourceDefinitions definitions) {
        this.definitions = Objects.requireNonNull(definitions, "definitions must not be null");
    }

    /**
     * Checks that a name is valid for a resource type. Checks the length, then the case, then the validation pattern.
     *
     * @param  resourceType                  the resource type or its alias
     * @param  name                          the name
     * @throws ResourceTypeNotFoundException if the resource type is not in the catalog
     * @throws ResourceNameInvalidException  if the name is not valid for the resource type
     */
    public void validateName(String resourceType, String name) {
        ResourceDefinition definition = definitions.getByIdentifier(resourceType);
        String type = definition.getResourceType();
        String value = Objects.requireNonNullElse(name, "");
        if (value.length() > definition.getMaxLength()) {
            throw ResourceNameInvalidException.withReason(type, value,
                    "length " + value.length() + " exceeds maximum length " + definition.getMaxLength());
        }
        if (value.length() < definition.getMinLength()) {
            throw ResourceNameInvalidException.withReason(type, value,
                    "length " + value.length() + " is below minimum length " + definition.getMinLength());
        }
        if (definition.isLowerCase() && !value.equals(value.toLowerCase(Locale.ROOT))) {
            throw ResourceNameInvalidException.withReason(type, value, "it must be lowercase");
        }
        if (!ResourceNameCleaner.matches(value, definition)) {
            throw ResourceNameInvalidException.doesNotMatchPattern(type, value, definition.getValidationRegex());
        }
    }
}
