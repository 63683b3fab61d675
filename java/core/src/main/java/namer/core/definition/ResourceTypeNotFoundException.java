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

/**
 * An exception for when a resource type could not be found in the catalog of resource definitions.
 */
public class ResourceTypeNotFoundException extends RuntimeException {

    private final String resourceType;

    private ResourceTypeNotFoundException(String resourceType) {
        super("Invalid resource type \"" + resourceType + "\"");
        this.resourceType = resourceType;
    }

    /**
     * Creates an instance of this class when we looked up the resource type by its identifier or alias.
     *
     * @param  resourceType the identifier we looked up
     * @return              an instance of this class
     */
    public static ResourceTypeNotFoundException withIdentifier(String resourceType) {
        return new ResourceTypeNotFoundException(resourceType);
    }

    public String getResourceType() {
        return resourceType;
    }
}
