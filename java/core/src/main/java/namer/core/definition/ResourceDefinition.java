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

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The naming constraints for one type of cloud resource. Patterns are compiled when the definition is built, so an
 * invalid pattern is reported as soon as the catalog is loaded.
 */
public class ResourceDefinition {
    private final String resourceType;
    private final String alias;
    private final String slug;
    private final int minLength;
    private final int maxLength;
    private final boolean lowerCase;
    private final String cleanRegex;
    private final String validationRegex;
    private final boolean dashes;
    private final String scope;
    private final Pattern cleanPattern;
    private final Pattern validationPattern;

    private ResourceDefinition(Builder builder) {
        resourceType = Objects.requireNonNull(builder.resourceType, "resourceType must not be null");
        alias = emptyToNull(builder.alias);
        slug = Objects.requireNonNullElse(builder.slug, "");
        minLength = builder.minLength;
        maxLength = builder.maxLength;
        lowerCase = builder.lowerCase;
        cleanRegex = Objects.requireNonNullElse(builder.cleanRegex, "");
        validationRegex = Objects.requireNonNullElse(builder.validationRegex, "");
        dashes = builder.dashes;
        scope = Objects.requireNonNullElse(builder.scope, "");
        validateLengths(resourceType, minLength, maxLength);
        cleanPattern = compile(resourceType, "clean", cleanRegex);
        validationPattern = compile(resourceType, "validation", validationRegex);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getResourceType() {
        return resourceType;
    }

    public Optional<String> getAlias() {
        return Optional.ofNullable(alias);
    }

    public String getSlug() {
        return slug;
    }

    public int getMinLength() {
        return minLength;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public boolean isLowerCase() {
        return lowerCase;
    }

    public String getCleanRegex() {
        return cleanRegex;
    }

    public String getValidationRegex() {
        return validationRegex;
    }

    public boolean isDashes() {
        return dashes;
    }

    public String getScope() {
        return scope;
    }

    /**
     * Retrieves the pattern matching characters that must be removed from input. Not set if the definition has no
     * clean regex.
     *
     * @return the compiled clean pattern, if any
     */
    public Optional<Pattern> getCleanPattern() {
        return Optional.ofNullable(cleanPattern);
    }

    /**
     * Retrieves the pattern a generated name must match in full. Not set if the definition has no validation regex,
     * in which case no name can be valid for this type.
     *
     * @return the compiled validation pattern, if any
     */
    public Optional<Pattern> getValidationPattern() {
        return Optional.ofNullable(validationPattern);
    }

    public Builder toBuilder() {
        return builder()
                .resourceType(resourceType)
                .alias(alias)
                .slug(slug)
                .minLength(minLength)
                .maxLength(maxLength)
                .lowerCase(lowerCase)
                .cleanRegex(cleanRegex)
                .validationRegex(validationRegex)
                .dashes(dashes)
                .scope(scope);
    }

    private static void validateLengths(String resourceType, int minLength, int maxLength) {
        if (minLength < 0) {
            throw new IllegalArgumentException("Minimum length must not be negative for resource type "
                    + resourceType + ", found " + minLength);
        }
        if (maxLength < minLength) {
            throw new IllegalArgumentException("Maximum length must not be less than minimum length for resource type "
                    + resourceType + ", found min " + minLength + " and max " + maxLength);
        }
    }

    private static Pattern compile(String resourceType, String patternName, String regex) {
        if (regex.isEmpty()) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw InvalidPatternException.forResourceType(resourceType, patternName, regex, e);
        }
    }

    private static String emptyToNull(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ResourceDefinition that = (ResourceDefinition) o;
        return minLength == that.minLength
                && maxLength == that.maxLength
                && lowerCase == that.lowerCase
                && dashes == that.dashes
                && Objects.equals(resourceType, that.resourceType)
                && Objects.equals(alias, that.alias)
                && Objects.equals(slug, that.slug)
                && Objects.equals(cleanRegex, that.cleanRegex)
                && Objects.equals(validationRegex, that.validationRegex)
                && Objects.equals(scope, that.scope);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resourceType, alias, slug, minLength, maxLength, lowerCase,
                cleanRegex, validationRegex, dashes, scope);
    }

    @Override
    public String toString() {
        return "ResourceDefinition{" +
                "resourceType='" + resourceType + '\'' +
                ", alias='" + alias + '\'' +
                ", slug='" + slug + '\'' +
                ", minLength=" + minLength +
                ", maxLength=" + maxLength +
                ", lowerCase=" + lowerCase +
                ", cleanRegex='" + cleanRegex + '\'' +
                ", validationRegex='" + validationRegex + '\'' +
                ", dashes=" + dashes +
                ", scope='" + scope + '\'' +
                '}';
    }

    /**
     * A builder for this class.
     */
    public static final class Builder {
        private String resourceType;
        private String alias;
        private String slug;
        private int minLength;
        private int maxLength;
        private boolean lowerCase;
        private String cleanRegex;
        private String validationRegex;
        private boolean dashes;
        private String scope;

        private Builder() {
        }

        /**
         * Sets the canonical identifier of the resource type, e.g. azurerm_resource_group.
         *
         * @param  resourceType the resource type
         * @return              this builder
         */
        public Builder resourceType(String resourceType) {
            this.resourceType = resourceType;
            return this;
        }

        /**
         * Sets a short identifier that can be used in place of the resource type when looking it up.
         *
         * @param  alias the alias
         * @return       this builder
         */
        public Builder alias(String alias) {
            this.alias = alias;
            return this;
        }

        public Builder slug(String slug) {
            this.slug = slug;
            return this;
        }

        public Builder minLength(int minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder lowerCase(boolean lowerCase) {
            this.lowerCase = lowerCase;
            return this;
        }

        /**
         * Sets the regex matching characters to remove from input. Note that every match is deleted, so this is
         * usually a negated character class.
         *
         * @param  cleanRegex the regex
         * @return            this builder
         */
        public Builder cleanRegex(String cleanRegex) {
            this.cleanRegex = cleanRegex;
            return this;
        }

        /**
         * Sets the regex that a generated name must match in full.
         *
         * @param  validationRegex the regex
         * @return                 this builder
         */
        public Builder validationRegex(String validationRegex) {
            this.validationRegex = validationRegex;
            return this;
        }

        public Builder dashes(boolean dashes) {
            this.dashes = dashes;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public ResourceDefinition build() {
            return new ResourceDefinition(this);
        }
    }
}
