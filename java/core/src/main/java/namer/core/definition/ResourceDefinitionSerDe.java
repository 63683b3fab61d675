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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.google.gson.reflect.TypeToken;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Serialises and deserialises the catalog of resource definitions to and from JSON. The catalog is a JSON array with
 * one object per resource type.
 */
public class ResourceDefinitionSerDe {
    private static final Type LIST_TYPE = new TypeToken<List<ResourceDefinitionJson>>() {
    }.getType();

    private final Gson gson;
    private final Gson gsonPrettyPrinting;

    public ResourceDefinitionSerDe() {
        this.gson = new GsonBuilder().create();
        this.gsonPrettyPrinting = new GsonBuilder().setPrettyPrinting().create();
    }

    /**
     * Serialises resource definitions to a JSON string.
     *
     * @param  definitions the definitions
     * @param  prettyPrint whether to pretty-print the JSON string
     * @return             a JSON string
     */
    public String toJson(List<ResourceDefinition> definitions, boolean prettyPrint) {
        List<ResourceDefinitionJson> json = definitions.stream()
                .map(ResourceDefinitionJson::from)
                .collect(Collectors.toList());
        if (prettyPrint) {
            return gsonPrettyPrinting.toJson(json, LIST_TYPE);
        }
        return gson.toJson(json, LIST_TYPE);
    }

    /**
     * Deserialises a JSON string to resource definitions.
     *
     * @param  json                    the JSON string
     * @return                         the definitions
     * @throws InvalidPatternException if any definition holds a regex that cannot be compiled
     */
    public List<ResourceDefinition> fromJson(String json) {
        return toDefinitions(gson.fromJson(json, LIST_TYPE));
    }

    /**
     * Deserialises JSON from a stream to resource definitions.
     *
     * @param  inputStream             an input stream of UTF-8 characters
     * @return                         the definitions
     * @throws InvalidPatternException if any definition holds a regex that cannot be compiled
     */
    public List<ResourceDefinition> fromJson(InputStream inputStream) {
        return toDefinitions(gson.fromJson(new InputStreamReader(inputStream, StandardCharsets.UTF_8), LIST_TYPE));
    }

    private static List<ResourceDefinition> toDefinitions(List<ResourceDefinitionJson> json) {
        if (json == null) {
            throw new JsonParseException("Expected a JSON array of resource definitions");
        }
        return json.stream()
                .map(ResourceDefinitionJson::toDefinition)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Reverses the escaping used in older catalogs, where a regex was stored as a quoted string inside the JSON
     * string, e.g. "\"^[a-z]{1,5}$\"". Regexes that are not wrapped in quotes are returned unchanged.
     *
     * @param  regex the regex as read from JSON
     * @return       the regex to compile
     */
    static String unquoteRegex(String regex) {
        if (regex == null || regex.length() < 2 || !regex.startsWith("\"") || !regex.endsWith("\"")) {
            return regex;
        }
        return regex.substring(1, regex.length() - 1)
                .replace("\\\"", "\"")
                .replace("\\\\", "\\");
    }

    /**
     * The JSON representation of a resource definition.
     */
    private static class ResourceDefinitionJson {
        private String name;
        private String alias;
        private String slug;
        @SerializedName("min_length")
        private int minLength;
        @SerializedName("max_length")
        private int maxLength;
        private boolean lowercase;
        private String regex;
        @SerializedName("validation_regex")
        private String validationRegex;
        private boolean dashes;
        private String scope;

        static ResourceDefinitionJson from(ResourceDefinition definition) {
            ResourceDefinitionJson json = new ResourceDefinitionJson();
            json.name = definition.getResourceType();
            json.alias = definition.getAlias().orElse(null);
            json.slug = definition.getSlug();
            json.minLength = definition.getMinLength();
            json.maxLength = definition.getMaxLength();
            json.lowercase = definition.isLowerCase();
            json.regex = definition.getCleanRegex();
            json.validationRegex = definition.getValidationRegex();
            json.dashes = definition.isDashes();
            json.scope = definition.getScope();
            return json;
        }

        ResourceDefinition toDefinition() {
            if (name == null || name.isEmpty()) {
                throw new JsonParseException("Resource definition has no name");
            }
            return ResourceDefinition.builder()
                    .resourceType(name)
                    .alias(alias)
                    .slug(slug)
                    .minLength(minLength)
                    .maxLength(maxLength)
                    .lowerCase(lowercase)
                    .cleanRegex(unquoteRegex(regex))
                    .validationRegex(unquoteRegex(validationRegex))
                    .dashes(dashes)
                    .scope(scope)
                    .build();
        }
    }
}
