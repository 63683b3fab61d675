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

import org.junit.jupiter.api.Test;

import namer.core.definition.ResourceDefinitions;

import java.util.List;

import static namer.core.definition.ResourceDefinitionTestHelper.resourceGroup;
import static namer.core.definition.ResourceDefinitionTestHelper.storageAccount;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ResourceTypeValidatorTest {

    private final ResourceTypeValidator validator = new ResourceTypeValidator(
            ResourceDefinitions.from(storageAccount(), resourceGroup()));

    @Test
    void shouldAcceptSingleResourceType() {
        assertThatCode(() -> validator.validate("test_storage_account", List.of()))
                .doesNotThrowAnyException();
    }

    @Test
    void shouldAcceptListOfResourceTypesAndAliases() {
        assertThatCode(() -> validator.validate("", List.of("test_storage_account", "trg")))
                .doesNotThrowAnyException();
    }

    @Test
    void shouldFailWhenNoResourceTypeIsSelected() {
        assertThatThrownBy(() -> validator.validate("", List.of()))
                .isInstanceOf(NoResourceTypeSelectedException.class)
                .hasMessage("No resource type was set. Either a resource type or a list of resource types is required.");
    }

    @Test
    void shouldFailWhenResourceTypesAreNull() {
        assertThatThrownBy(() -> validator.validate(null, null))
                .isInstanceOf(NoResourceTypeSelectedException.class);
    }

    @Test
    void shouldFailWithSingleInvalidResourceType() {
        assertThatThrownBy(() -> validator.validate("bad_type", List.of("test_storage_account")))
                .isInstanceOfSatisfying(ResourceTypesInvalidException.class,
                        e -> assertThat(e.getInvalidResourceTypes()).containsExactly("bad_type"))
                .hasMessage("Invalid resource type \"bad_type\"");
    }

    @Test
    void shouldReportAllInvalidResourceTypes() {
        assertThatThrownBy(() -> validator.validate("bad1", List.of("test_storage_account", "bad2", "bad1")))
                .isInstanceOfSatisfying(ResourceTypesInvalidException.class,
                        e -> assertThat(e.getInvalidResourceTypes()).containsExactly("bad1", "bad2"))
                .hasMessage("Found 2 invalid resource types: \"bad1\", \"bad2\"");
    }

    @Test
    void shouldSkipEmptyEntriesInList() {
        assertThatCode(() -> validator.validate("", List.of("", "test_storage_account")))
                .doesNotThrowAnyException();
    }
}
