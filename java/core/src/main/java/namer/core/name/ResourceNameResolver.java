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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import namer.core.definition.ResourceDefinition;
import namer.core.definition.ResourceDefinitions;
import namer.core.definition.ResourceTypeNotFoundException;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import static namer.core.name.ResourceNameCleaner.clean;
import static namer.core.name.ResourceNameCleaner.cleanAll;

/**
 * Generates a name for a resource type from the caller's input. Cleans the input, composes the name within the
 * maximum length for the resource type, applies the required case, and validates the result.
 */
public class ResourceNameResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceNameResolver.class);

    private final ResourceDefinitions definitions;

    public ResourceNameResolver(ResourceDefinitions definitions) {
        this.definitions = Objects.requireNonNull(definitions, "definitions must not be null");
    }

    /**
     * Generates a name for a resource type.
     *
     * @param  resourceType                  the resource type or its alias
     * @param  parameters                    the caller's input
     * @return                               the name
     * @throws ResourceTypeNotFoundException if the resource type is not in the catalog
     * @throws ResourceNameInvalidException  if the name does not satisfy the validation pattern of the resource type
     */
    public String resolveName(String resourceType, NamingParameters parameters) {
        ResourceDefinition definition = definitions.getByIdentifier(resourceType);
        String slug = parameters.isUseSlug() && !parameters.isPassthrough() ? definition.getSlug() : "";
        ResourceDefinition cleanWith = parameters.isCleanInput() ? definition : null;
        List<String> prefixes = cleanAll(parameters.getPrefixes(), cleanWith);
        List<String> suffixes = cleanAll(parameters.getSuffixes(), cleanWith);
        String name = clean(parameters.getName(), cleanWith);
        String separator = clean(parameters.getSeparator(), cleanWith);
        String randomSuffix = clean(parameters.getRandomSuffix(), cleanWith);

        String composed;
        if (parameters.isPassthrough()) {
            composed = name;
        } else {
            composed = NameComposer.compose(CompositionRequest.builder()
                    .separator(separator)
                    .prefixes(prefixes)
                    .name(name)
                    .slug(slug)
                    .suffixes(suffixes)
                    .randomSuffix(randomSuffix)
                    .maxLength(definition.getMaxLength())
                    .precedence(parameters.getPrecedence())
                    .build());
        }
        String result = trimToLength(composed, definition.getMaxLength());
        if (definition.isLowerCase()) {
            result = result.toLowerCase(Locale.ROOT);
        }
        if (!ResourceNameCleaner.matches(result, definition)) {
            LOGGER.debug("Rejected name {} for resource type {}", result, definition.getResourceType());
            throw ResourceNameInvalidException.doesNotMatchPattern(
                    definition.getResourceType(), result, definition.getValidationRegex());
        }
        LOGGER.debug("Generated name {} for resource type {}", result, definition.getResourceType());
        return result;
    }

    private static String trimToLength(String name, int maxLength) {
        if (name.length() > maxLength) {
            return name.substring(0, maxLength);
        }
        return name;
    }
}
