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
 * Thrown when a request does not set a resource type or a list of resource types.
 */
public class NoResourceTypeSelectedException extends IllegalArgumentException {

    public NoResourceTypeSelectedException() {
        super("No resource type was set. Either a resource type or a list of resource types is required.");
    }
}
