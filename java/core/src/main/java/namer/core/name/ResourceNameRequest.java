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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A request to generate names for one or more resource types from the same input. A random seed of 0 means that no
 * seed was chosen, and one will be generated.
 */
public class ResourceNameRequest {
    private final String resourceType;
    private final List<String> resourceTypes;
    private final String name;
    private final List<String> prefixes;
    private final List<String> suffixes;
    private final String separator;
    private final int randomLength;
    private final long randomSeed;
    private final String randomString;
    private final boolean cleanInput;
    private final boolean passthrough;
    private final boolean useSlug;

    private ResourceNameRequest(Builder builder) {
        resourceType = Objects.requireNonNullElse(builder.resourceType, "");
        resourceTypes = List.copyOf(Objects.requireNonNullElse(builder.resourceTypes, List.of()));
        name = Objects.requireNonNullElse(builder.name, "");
        prefixes = List.copyOf(Objects.requireNonNullElse(builder.prefixes, List.of()));
        suffixes = List.copyOf(Objects.requireNonNullElse(builder.suffixes, List.of()));
        separator = Objects.requireNonNullElse(builder.separator, "");
        randomLength = builder.randomLength;
        randomSeed = builder.randomSeed;
        randomString = Objects.requireNonNullElse(builder.randomString, "");
        cleanInput = builder.cleanInput;
        passthrough = builder.passthrough;
        useSlug = builder.useSlug;
        if (randomLength < 0) {
            throw new IllegalArgumentException("Random length must not be negative, found " + randomLength);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getResourceType() {
        return resourceType;
    }

    public List<String> getResourceTypes() {
        return resourceTypes;
    }

    public String getName() {
        return name;
    }

    public List<String> getPrefixes() {
        return prefixes;
    }

    public List<String> getSuffixes() {
        return suffixes;
    }

    public String getSeparator() {
        return separator;
    }

    public int getRandomLength() {
        return randomLength;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public String getRandomString() {
        return randomString;
    }

    public boolean isCleanInput() {
        return cleanInput;
    }

    public boolean isPassthrough() {
        return passthrough;
    }

    public boolean isUseSlug() {
        return useSlug;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ResourceNameRequest that = (ResourceNameRequest) o;
        return randomLength == that.randomLength
                && randomSeed == that.randomSeed
                && cleanInput == that.cleanInput
                && passthrough == that.passthrough
                && useSlug == that.useSlug
                && Objects.equals(resourceType, that.resourceType)
                && Objects.equals(resourceTypes, that.resourceTypes)
                && Objects.equals(name, that.name)
                && Objects.equals(prefixes, that.prefixes)
                && Objects.equals(suffixes, that.suffixes)
                && Objects.equals(separator, that.separator)
                && Objects.equals(randomString, that.randomString);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resourceType, resourceTypes, name, prefixes, suffixes, separator,
                randomLength, randomSeed, randomString, cleanInput, passthrough, useSlug);
    }

    @Override
    public String toString() {
        return "ResourceNameRequest{" +
                "resourceType='" + resourceType + '\'' +
                ", resourceTypes=" + resourceTypes +
                ", name='" + name + '\'' +
                ", prefixes=" + prefixes +
                ", suffixes=" + suffixes +
                ", separator='" + separator + '\'' +
                ", randomLength=" + randomLength +
                ", randomSeed=" + randomSeed +
                ", randomString='" + randomString + '\'' +
                ", cleanInput=" + cleanInput +
                ", passthrough=" + passthrough +
                ", useSlug=" + useSlug +
                '}';
    }

    /**
     * A builder for this class. Defaults to a separator of "-", no random suffix, with input cleaning and the slug
     * turned on.
     */
    public static final class Builder {
        private String resourceType;
        private List<String> resourceTypes;
        private String name;
        private List<String> prefixes;
        private List<String> suffixes;
        private String separator = NamingParameters.DEFAULT_SEPARATOR;
        private int randomLength = 0;
        private long randomSeed = 0;
        private String randomString;
        private boolean cleanInput = true;
        private boolean passthrough = false;
        private boolean useSlug = true;

        private Builder() {
        }

        public Builder resourceType(String resourceType) {
            this.resourceType = resourceType;
            return this;
        }

        public Builder resourceTypes(List<String> resourceTypes) {
            this.resourceTypes = resourceTypes;
            return this;
        }

        public Builder resourceTypes(String... resourceTypes) {
            return resourceTypes(Arrays.asList(resourceTypes));
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder prefixes(List<String> prefixes) {
            this.prefixes = prefixes;
            return this;
        }

        public Builder prefixes(String... prefixes) {
            return prefixes(Arrays.asList(prefixes));
        }

        public Builder suffixes(List<String> suffixes) {
            this.suffixes = suffixes;
            return this;
        }

        public Builder suffixes(String... suffixes) {
            return suffixes(Arrays.asList(suffixes));
        }

        public Builder separator(String separator) {
            this.separator = separator;
            return this;
        }

        public Builder randomLength(int randomLength) {
            this.randomLength = randomLength;
            return this;
        }

        /**
         * Sets the seed for the random suffix. Set this to the seed reported for an earlier request to generate the
         * same random suffix again.
         *
         * @param  randomSeed the seed, or 0 to generate one
         * @return            this builder
         */
        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        /**
         * Sets a random suffix to use instead of generating one. This is used to keep the suffix generated for an
         * earlier request.
         *
         * @param  randomString the random suffix
         * @return              this builder
         */
        public Builder randomString(String randomString) {
            this.randomString = randomString;
            return this;
        }

        public Builder cleanInput(boolean cleanInput) {
            this.cleanInput = cleanInput;
            return this;
        }

        public Builder passthrough(boolean passthrough) {
            this.passthrough = passthrough;
            return this;
        }

        public Builder useSlug(boolean useSlug) {
            this.useSlug = useSlug;
            return this;
        }

        public ResourceNameRequest build() {
            return new ResourceNameRequest(this);
        }
    }
}
