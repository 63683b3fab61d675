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

/**
 * Thrown when a name is not acceptable for a resource type. This can occur when a generated name fails validation, or
 * when checking a name chosen by the caller.
 */
public class ResourceNameInvalidException extends IllegalArgumentException {

    private final String resourceType;
    private final String name;

    private ResourceNameInvalidException(String message, String resourceType, String name) {
        super(message);
        this.resourceType = resourceType;
        this.name = name;
    }

    /**
     * Creates an instance of this class when a name does not match the validation pattern for its resource type.
     *
     * @param  resourceType the resource type
     * @param  name         the name that was rejected
     * @param  pattern      the validation pattern, or an empty string if the resource type has none
     * @return              an instance of this class
     */
    public static ResourceNameInvalidException doesNotMatchPattern(String resourceType, String name, String pattern) {
        if (pattern.isEmpty()) {
            return new ResourceNameInvalidException("Name \"" + name + "\" is invalid for resource type " + resourceType
                    + ", which has no validation pattern", resourceType, name);
        }
        return new ResourceNameInvalidException("Name \"" + name + "\" is invalid for resource type " + resourceType
                + ", it does not match pattern \"" + pattern + "\"", resourceType, name);
    }

    /**
     * Creates an instance of this class when a name breaks another constraint of its resource type.
     *
     * @param  resourceType the resource type
     * @param  name         the name that was rejected
     * @param  reason       a description of the constraint that was broken
     * @return              an instance of this class
     */
    public static ResourceNameInvalidException withReason(String resourceType, String name, String reason) {
        return new ResourceNameInvalidException("Name \"" + name + "\" is invalid for resource type " + resourceType
                + ", " + reason, resourceType, name);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getName() {
        return name;
    }
}
