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
 * The caller's input for naming a resource, independent of the resource type.
 */
public class NamingParameters {
    public static final String DEFAULT_SEPARATOR = "-";

    private final String separator;
    private final List<String> prefixes;
    private final String name;
    private final List<String> suffixes;
    private final String randomSuffix;
    private final boolean cleanInput;
    private final boolean passthrough;
    private final boolean useSlug;
    private final List<NameComponent> precedence;

    private NamingParameters(Builder builder) {
        separator = Objects.requireNonNullElse(builder.separator, "");
        prefixes = List.copyOf(Objects.requireNonNullElse(builder.prefixes, List.of()));
        name = Objects.requireNonNullElse(builder.name, "");
        suffixes = List.copyOf(Objects.requireNonNullElse(builder.suffixes, List.of()));
        randomSuffix = Objects.requireNonNullElse(builder.randomSuffix, "");
        cleanInput = builder.cleanInput;
        passthrough = builder.passthrough;
        useSlug = builder.useSlug;
        precedence = List.copyOf(Objects.requireNonNull(builder.precedence, "precedence must not be null"));
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

    public List<String> getSuffixes() {
        return suffixes;
    }

    public String getRandomSuffix() {
        return randomSuffix;
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
        NamingParameters that = (NamingParameters) o;
        return cleanInput == that.cleanInput
                && passthrough == that.passthrough
                && useSlug == that.useSlug
                && Objects.equals(separator, that.separator)
                && Objects.equals(prefixes, that.prefixes)
                && Objects.equals(name, that.name)
                && Objects.equals(suffixes, that.suffixes)
                && Objects.equals(randomSuffix, that.randomSuffix)
                && Objects.equals(precedence, that.precedence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(separator, prefixes, name, suffixes, randomSuffix, cleanInput, passthrough, useSlug, precedence);
    }

    @Override
    public String toString() {
        return "NamingParameters{" +
                "separator='" + separator + '\'' +
                ", prefixes=" + prefixes +
                ", name='" + name + '\'' +
                ", suffixes=" + suffixes +
                ", randomSuffix='" + randomSuffix + '\'' +
                ", cleanInput=" + cleanInput +
                ", passthrough=" + passthrough +
                ", useSlug=" + useSlug +
                ", precedence=" + precedence +
                '}';
    }

    /**
     * A builder for this class. Defaults to a separator of "-", with input cleaning and the slug turned on.
     */
    public static final class Builder {
        private String separator = DEFAULT_SEPARATOR;
        private List<String> prefixes;
        private String name;
        private List<String> suffixes;
        private String randomSuffix;
        private boolean cleanInput = true;
        private boolean passthrough = false;
        private boolean useSlug = true;
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

        /**
         * Sets whether to remove characters the resource type does not allow from each input before composing the
         * name. If this is turned off, a name containing such characters will fail validation.
         *
         * @param  cleanInput true to clean input
         * @return            this builder
         */
        public Builder cleanInput(boolean cleanInput) {
            this.cleanInput = cleanInput;
            return this;
        }

        /**
         * Sets whether to use the name as it is, without adding the slug, prefixes, suffixes or random suffix. The
         * name is still cut to the maximum length, lowercased if required, and validated.
         *
         * @param  passthrough true to use the name as it is
         * @return             this builder
         */
        public Builder passthrough(boolean passthrough) {
            this.passthrough = passthrough;
            return this;
        }

        public Builder useSlug(boolean useSlug) {
            this.useSlug = useSlug;
            return this;
        }

        public Builder precedence(List<NameComponent> precedence) {
            this.precedence = precedence;
            return this;
        }

        public Builder precedence(NameComponent... precedence) {
            return precedence(Arrays.asList(precedence));
        }

        public NamingParameters build() {
            return new NamingParameters(this);
        }
    }
}
