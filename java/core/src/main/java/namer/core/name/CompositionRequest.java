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
 * The components to assemble into a name, with the length limit and the order in which components are kept.
 */
public class CompositionRequest {
    private final String separator;
    private final List<String> prefixes;
    private final String name;
    private final String slug;
    private final List<String> suffixes;
    private final String randomSuffix;
    private final int maxLength;
    private final List<NameComponent> precedence;

    private CompositionRequest(Builder builder) {
        separator = Objects.requireNonNullElse(builder.separator, "");
        prefixes = List.copyOf(Objects.requireNonNullElse(builder.prefixes, List.of()));
        name = Objects.requireNonNullElse(builder.name, "");
        slug = Objects.requireNonNullElse(builder.slug, "");
        suffixes = List.copyOf(Objects.requireNonNullElse(builder.suffixes, List.of()));
        randomSuffix = Objects.requireNonNullElse(builder.randomSuffix, "");
        maxLength = builder.maxLength;
        precedence = List.copyOf(Objects.requireNonNull(builder.precedence, "precedence must not be null"));
        if (maxLength < 0) {
            throw new IllegalArgumentException("Maximum length must not be negative, found " + maxLength);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSeparator() {
        return separator;
    }

    public List<String> getPrefixes() {
        return prefixes;
    }

    public String getName() {
        return name;
    }

    public String getSlug() {
        return slug;
    }

    public List<String> getSuffixes() {
        return suffixes;
    }

    public String getRandomSuffix() {
        return randomSuffix;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public List<NameComponent> getPrecedence() {
        return precedence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CompositionRequest that = (CompositionRequest) o;
        return maxLength == that.maxLength
                && Objects.equals(separator, that.separator)
                && Objects.equals(prefixes, that.prefixes)
                && Objects.equals(name, that.name)
                && Objects.equals(slug, that.slug)
                && Objects.equals(suffixes, that.suffixes)
                && Objects.equals(randomSuffix, that.randomSuffix)
                && Objects.equals(precedence, that.precedence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(separator, prefixes, name, slug, suffixes, randomSuffix, maxLength, precedence);
    }

    @Override
    public String toString() {
        return "CompositionRequest{" +
                "separator='" + separator + '\'' +
                ", prefixes=" + prefixes +
                ", name='" + name + '\'' +
                ", slug='" + slug + '\'' +
                ", suffixes=" + suffixes +
                ", randomSuffix='" + randomSuffix + '\'' +
                ", maxLength=" + maxLength +
                ", precedence=" + precedence +
                '}';
    }

    /**
     * A builder for this class.
     */
    public static final class Builder {
        private String separator;
        private List<String> prefixes;
        private String name;
        private String slug;
        private List<String> suffixes;
        private String randomSuffix;
        private int maxLength;
        private List<NameComponent> precedence = NameComponent.DEFAULT_PRECEDENCE;

        private Builder() {
        }

        public Builder separator(String separator) {
            this.separator = separator;
            return this;
        }

        public Builder prefixes(List<String> prefixes) {
            this.prefixes = prefixes;
            return this;
        }

        public Builder prefixes(String... prefixes) {
            return prefixes(Arrays.asList(prefixes));
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder slug(String slug) {
            this.slug = slug;
            return this;
        }

        public Builder suffixes(List<String> suffixes) {
            this.suffixes = suffixes;
            return this;
        }

        public Builder suffixes(String... suffixes) {
            return suffixes(Arrays.asList(suffixes));
        }

        public Builder randomSuffix(String randomSuffix) {
            this.randomSuffix = randomSuffix;
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        /**
         * Sets the order in which components are admitted within the maximum length. Defaults to
         * {@link NameComponent#DEFAULT_PRECEDENCE}.
         *
         * @param  precedence the components, highest priority first
         * @return            this builder
         */
        public Builder precedence(List<NameComponent> precedence) {
            this.precedence = precedence;
            return this;
        }

        public Builder precedence(NameComponent... precedence) {
            return precedence(Arrays.asList(precedence));
        }

        public CompositionRequest build() {
            return new CompositionRequest(this);
        }
    }
}
