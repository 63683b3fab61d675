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
package namer.core.definition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The catalog of naming constraints for every supported resource type. Resource types can be looked up by their
 * identifier or by an alias. This is built once and then only read, so it can be shared between threads.
 */
public class ResourceDefinitions {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceDefinitions.class);

    /**
     * The classpath location of the catalog bundled with this module.
     */
    public static final String DEFAULT_RESOURCE = "/resourceDefinition.json";

    private final Map<String, ResourceDefinition> byResourceType;
    private final Map<String, ResourceDefinition> byAlias;

    private ResourceDefinitions(List<ResourceDefinition> definitions) {
        Map<String, ResourceDefinition> types = new LinkedHashMap<>();
        Map<String, ResourceDefinition> aliases = new HashMap<>();
        for (ResourceDefinition definition : definitions) {
            if (types.putIfAbsent(definition.getResourceType(), definition) != null) {
                throw new IllegalArgumentException("Duplicate resource type: " + definition.getResourceType());
            }
            definition.getAlias().ifPresent(alias -> {
                ResourceDefinition existing = aliases.putIfAbsent(alias, definition);
                if (existing != null) {
                    throw new IllegalArgumentException("Alias " + alias + " is used by resource types "
                            + existing.getResourceType() + " and " + definition.getResourceType());
                }
            });
        }
        byResourceType = Collections.unmodifiableMap(types);
        byAlias = Collections.unmodifiableMap(aliases);
    }

    /**
     * Creates a catalog from definitions built in code.
     *
     * @param  definitions the definitions
     * @return             the catalog
     */
    public static ResourceDefinitions from(List<ResourceDefinition> definitions) {
        return new ResourceDefinitions(definitions);
    }

    /**
     * Creates a catalog from definitions built in code.
     *
     * @param  definitions the definitions
     * @return             the catalog
     */
    public static ResourceDefinitions from(ResourceDefinition... definitions) {
        return from(List.of(definitions));
    }

    /**
     * Creates a catalog from a JSON string in the catalog format.
     *
     * @param  json the JSON
     * @return      the catalog
     */
    public static ResourceDefinitions fromJson(String json) {
        return from(new ResourceDefinitionSerDe().fromJson(json));
    }

    /**
     * Loads a catalog from a JSON file.
     *
     * @param  path        the path to the file
     * @return             the catalog
     * @throws IOException if the file could not be read
     */
    public static ResourceDefinitions load(Path path) throws IOException {
        ResourceDefinitions definitions = fromJson(Files.readString(path));
        LOGGER.info("Loaded {} resource definitions with {} aliases from {}",
                definitions.byResourceType.size(), definitions.byAlias.size(), path);
        return definitions;
    }

    /**
     * Loads the catalog bundled on the classpath.
     *
     * @return the catalog
     */
    public static ResourceDefinitions loadDefault() {
        try (InputStream stream = ResourceDefinitions.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (stream == null) {
                throw new IllegalStateException("Resource definitions not found on classpath at " + DEFAULT_RESOURCE);
            }
            ResourceDefinitions definitions = from(new ResourceDefinitionSerDe().fromJson(stream));
            LOGGER.info("Loaded {} resource definitions with {} aliases from classpath",
                    definitions.byResourceType.size(), definitions.byAlias.size());
            return definitions;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Looks up a resource definition by its resource type, falling back to aliases. Lookup is case sensitive.
     *
     * @param  identifier                    the resource type or alias
     * @return                               the resource definition
     * @throws ResourceTypeNotFoundException if no resource type or alias matches the identifier
     */
    public ResourceDefinition getByIdentifier(String identifier) throws ResourceTypeNotFoundException {
        return findByIdentifier(identifier)
                .orElseThrow(() -> ResourceTypeNotFoundException.withIdentifier(identifier));
    }

    /**
     * Looks up a resource definition by its resource type, falling back to aliases. Lookup is case sensitive.
     *
     * @param  identifier the resource type or alias
     * @return            the resource definition, or an empty optional if none matched
     */
    public Optional<ResourceDefinition> findByIdentifier(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        ResourceDefinition definition = byResourceType.get(identifier);
        if (definition == null) {
            definition = byAlias.get(identifier);
        }
        return Optional.ofNullable(definition);
    }

    public boolean contains(String identifier) {
        return findByIdentifier(identifier).isPresent();
    }

    /**
     * Retrieves the slug for a resource type.
     *
     * @param  identifier                    the resource type or alias
     * @return                               the slug, or an empty string if the type has none
     * @throws ResourceTypeNotFoundException if no resource type or alias matches the identifier
     */
    public String getSlug(String identifier) throws ResourceTypeNotFoundException {
        return getByIdentifier(identifier).getSlug();
    }

    public Stream<ResourceDefinition> streamAll() {
        return byResourceType.values().stream();
    }

    public int size() {
        return byResourceType.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ResourceDefinitions that = (ResourceDefinitions) o;
        return Objects.equals(byResourceType, that.byResourceType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(byResourceType);
    }

    @Override
    public String toString() {
        return "ResourceDefinitions{resourceTypes=" + byResourceType.keySet() + ", aliases=" + byAlias.keySet() + '}';
    }
}
