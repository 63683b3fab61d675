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

import java.util.regex.PatternSyntaxException;

/**
 * Thrown when a resource definition holds a regex that cannot be compiled. This is a defect in the catalog of
 * definitions rather than in a request to generate a name.
 */
public class InvalidPatternException extends IllegalArgumentException {

    private final String resourceType;
    private final String pattern;

    private InvalidPatternException(String message, String resourceType, String pattern, Exception cause) {
        super(message, cause);
        this.resourceType = resourceType;
        this.pattern = pattern;
    }

    /**
     * Creates an instance of this class for a pattern held in a resource definition.
     *
     * @param  resourceType the resource type the pattern was configured for
     * @param  patternName  which of the patterns was invalid, e.g. clean or validation
     * @param  pattern      the pattern text
     * @param  cause        the failure compiling the pattern
     * @return              an instance of this class
     */
    public static InvalidPatternException forResourceType(
            String resourceType, String patternName, String pattern, PatternSyntaxException cause) {
        return new InvalidPatternException(
                "Invalid " + patternName + " regex for resource type " + resourceType + ": \"" + pattern + "\"",
                resourceType, pattern, cause);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getPattern() {
        return pattern;
    }
}
