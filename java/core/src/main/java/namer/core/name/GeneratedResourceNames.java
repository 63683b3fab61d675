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

import org.apache.commons.codec.binary.Base64;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The names generated for a request, with the random seed and suffix that were used. Passing the seed or suffix back
 * in a later request will reproduce the same names.
 */
public class GeneratedResourceNames {
    private final String result;
    private final Map<String, String> results;
    private final String id;
    private final long randomSeed;
    private final String randomString;

    private GeneratedResourceNames(Builder builder) {
        result = builder.result;
        results = Collections.unmodifiableMap(new LinkedHashMap<>(builder.results));
        id = Base64.encodeBase64String(String.join("\n", builder.idLines).getBytes(StandardCharsets.UTF_8));
        randomSeed = builder.randomSeed;
        randomString = builder.randomString;
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * Retrieves the name generated for the single resource type in the request.
     *
     * @return the name, or an empty string if the request only had a list of resource types
     */
    public String getResult() {
        return result;
    }

    /**
     * Retrieves the names generated for each resource type, in the order they were requested.
     *
     * @return a map from resource type to name
     */
    public Map<String, String> getResults() {
        return results;
    }

    /**
     * Retrieves an identifier for this set of names. This is the Base64 encoding of a line per generated name, each
     * holding the resource type and the name separated by a tab.
     *
     * @return the identifier
     */
    public String getId() {
        return id;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public String getRandomString() {
        return randomString;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GeneratedResourceNames that = (GeneratedResourceNames) o;
        return randomSeed == that.randomSeed
                && Objects.equals(result, that.result)
                && Objects.equals(results, that.results)
                && Objects.equals(id, that.id)
                && Objects.equals(randomString, that.randomString);
    }

    @Override
    public int hashCode() {
        return Objects.hash(result, results, id, randomSeed, randomString);
    }

    @Override
    public String toString() {
        return "GeneratedResourceNames{" +
                "result='" + result + '\'' +
                ", results=" + results +
                ", id='" + id + '\'' +
                ", randomSeed=" + randomSeed +
                ", randomString='" + randomString + '\'' +
                '}';
    }

    /**
     * A builder for this class, adding names as they are generated.
     */
    static final class Builder {
        private String result = "";
        private final Map<String, String> results = new LinkedHashMap<>();
        private final List<String> idLines = new ArrayList<>();
        private long randomSeed;
        private String randomString = "";

        private Builder() {
        }

        Builder result(String resourceType, String name) {
            result = name;
            return name(resourceType, name);
        }

        Builder name(String resourceType, String name) {
            results.put(resourceType, name);
            idLines.add(resourceType + "\t" + name);
            return this;
        }

        Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        Builder randomString(String randomString) {
            this.randomString = randomString;
            return this;
        }

        GeneratedResourceNames build() {
            return new GeneratedResourceNames(this);
        }
    }
}
