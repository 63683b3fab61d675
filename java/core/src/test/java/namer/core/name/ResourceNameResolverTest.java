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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import namer.core.definition.ResourceDefinitions;
import namer.core.definition.ResourceTypeNotFoundException;

import static namer.core.definition.ResourceDefinitionTestHelper.resourceGroup;
import static namer.core.definition.ResourceDefinitionTestHelper.storageAccount;
import static namer.core.definition.ResourceDefinitionTestHelper.withNoPatterns;
import static namer.core.name.NameComponent.NAME;
import static namer.core.name.NameComponent.PREFIXES;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ResourceNameResolverTest {

    private final ResourceNameResolver resolver = new ResourceNameResolver(
            ResourceDefinitions.from(storageAccount(), resourceGroup(), withNoPatterns("test_no_patterns")));

    @Nested
    @DisplayName("Compose names")
    class Compose {

        @Test
        void shouldComposeNameWithSlugPrefixesAndSuffixes() {
            // Given
            NamingParameters parameters = NamingParameters.builder()
                    .prefixes("dev").name("myapp").suffixes("001").build();

            // When / Then
            assertThat(resolver.resolveName("test_resource_group", parameters))
                    .isEqualTo("dev-rg-myapp-001");
        }

        @Test
        void shouldCleanInputsBeforeComposing() {
            // Given
            NamingParameters parameters = NamingParameters.builder()
                    .name("my app!").build();

            // When / Then
            assertThat(resolver.resolveName("test_resource_group", parameters))
                    .isEqualTo("rg-myapp");
        }

        @Test
        void shouldCleanSeparatorWhenNotAllowedByResourceType() {
            // Given
            NamingParameters parameters = NamingParameters.builder()
                    .name("myapp").randomSuffix("xyz").build();

            // When / Then
            assertThat(resolver.resolveName("test_storage_account", parameters))
                    .isEqualTo("stmyappxyz");
        }

        @Test
        void shouldResolveResourceTypeByAlias() {
            // Given
            NamingParameters parameters = NamingParameters.builder()
                    .name("myapp").randomSuffix("xyz").build();

            // When / Then
            assertThat(resolver.resolveName("tst", parameters))
                    .isEqualTo("stmyappxyz");
        }

        @Test
        void shouldLeaveOutSlugWhenNotUsed() {
            // Given
            NamingParameters parameters = NamingParameters.builder()
                    .name("myapp").useSlug(false).build();

            // When / Then
            assertThat(resolver.resolveName("test_resource_group", parameters))
                    .isEqualTo("myapp");
        }

        @Test
        void shouldApplyPrecedence() {
            // Given
            NamingParameters parameters = NamingParameters.builder()
                    .prefixes("dev").name("myapp").suffixes("001")
                    .precedence(PREFIXES, NAME)
                    .build();

            // When / Then
            assertThat(resolver.resolveName("test_resource_group", parameters))
                    .isEqualTo("dev-myapp");
        }

        @Test
        void shouldLowercaseWhenRequiredByResourceType() {
            // Given
            NamingParameters parameters = NamingParameters.builder()
                    .separator("").name("MyApp").useSlug(false).cleanInput(false).build();

            // When / Then
            assertThat(resolver.resolveName("test_storage_account", parameters))
                    .isEqualTo("myapp");
        }
    }

    @Nested
    @DisplayName("Pass through names")
    class Passthrough {

        @Test
        void shouldUseNameAsGiven() {
            // Given
            NamingParameters parameters = NamingParameters.builder()
                    .prefixes("dev").name("Exact-Name").suffixes("001").randomSuffix("xyz")
                    .passthrough(true).build();

            // When / Then
            assertThat(resolver.resolveName("test_resource_group", parameters))
                    .isEqualTo("Exact-Name");
        }

        @Test
        void shouldTrimNameToMaximumLength() {
            // Given
            NamingParameters parameters = NamingParameters.builder()
                    .name("a".repeat(30)).passthrough(true).build();

            // When / Then
            assertThat(resolver.resolveName("test_storage_account", parameters))
                    .isEqualTo("a".repeat(24));
        }

        @Test
        void shouldLowercaseUncleanedName() {
            // Given
            NamingParameters parameters = NamingParameters.builder()
                    .name("MyStorage").passthrough(true).cleanInput(false).build();

            // When / Then
            assertThat(resolver.resolveName("test_storage_account", parameters))
                    .isEqualTo("mystorage");
        }
    }

    @Nested
    @DisplayName("Reject invalid names")
    class RejectInvalid {

        @Test
        void shouldRejectUncleanedCharacterNotAllowedByResourceType() {
            // Given
            NamingParameters parameters = NamingParameters.builder()
                    .separator("").name("my@app").cleanInput(false).build();

            // When / Then
            assertThatThrownBy(() -> resolver.resolveName("tst", parameters))
                    .isInstanceOfSatisfying(ResourceNameInvalidException.class, e -> {
                        assertThat(e.getResourceType()).isEqualTo("test_storage_account");
                        assertThat(e.getName()).isEqualTo("stmy@app");
                    })
                    .hasMessage("Name \"stmy@app\" is invalid for resource type test_storage_account, " +
                            "it does not match pattern \"^[a-z0-9]{3,24}$\"");
        }

        @Test
        void shouldRejectNameTooShortAfterCleaning() {
            // Given
            NamingParameters parameters = NamingParameters.builder()
                    .name("!!").useSlug(false).build();

            // When / Then
            assertThatThrownBy(() -> resolver.resolveName("test_storage_account", parameters))
                    .isInstanceOf(ResourceNameInvalidException.class);
        }

        @Test
        void shouldRejectEveryNameForResourceTypeWithNoValidationPattern() {
            // Given
            NamingParameters parameters = NamingParameters.builder().name("abc").build();

            // When / Then
            assertThatThrownBy(() -> resolver.resolveName("test_no_patterns", parameters))
                    .isInstanceOf(ResourceNameInvalidException.class)
                    .hasMessage("Name \"np-abc\" is invalid for resource type test_no_patterns, " +
                            "which has no validation pattern");
        }

        @Test
        void shouldFailWithUnknownResourceType() {
            // Given
            NamingParameters parameters = NamingParameters.builder().name("abc").build();

            // When / Then
            assertThatThrownBy(() -> resolver.resolveName("unknown_type", parameters))
                    .isInstanceOf(ResourceTypeNotFoundException.class)
                    .hasMessage("Invalid resource type \"unknown_type\"");
        }
    }
}
