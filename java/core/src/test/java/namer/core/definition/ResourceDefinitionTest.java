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

import org.junit.jupiter.api.Test;

import java.util.regex.PatternSyntaxException;

import static namer.core.definition.ResourceDefinitionTestHelper.storageAccount;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ResourceDefinitionTest {

    @Test
    void shouldCompilePatternsWhenBuilt() {
        // When
        ResourceDefinition definition = storageAccount();

        // Then
        assertThat(definition.getCleanPattern())
                .get().extracting(Object::toString).isEqualTo("[^0-9a-z]");
        assertThat(definition.getValidationPattern())
                .get().extracting(Object::toString).isEqualTo("^[a-z0-9]{3,24}$");
    }

    @Test
    void shouldHaveNoPatternsWhenRegexesAreNotSet() {
        // When
        ResourceDefinition definition = ResourceDefinition.builder()
                .resourceType("no_patterns")
                .maxLength(10)
                .build();

        // Then
        assertThat(definition.getCleanPattern()).isEmpty();
        assertThat(definition.getValidationPattern()).isEmpty();
        assertThat(definition.getCleanRegex()).isEmpty();
        assertThat(definition.getValidationRegex()).isEmpty();
        assertThat(definition.getSlug()).isEmpty();
        assertThat(definition.getAlias()).isEmpty();
    }

    @Test
    void shouldTreatEmptyAliasAsNotSet() {
        // When
        ResourceDefinition definition = storageAccount().toBuilder().alias("").build();

        // Then
        assertThat(definition.getAlias()).isEmpty();
    }

    @Test
    void shouldFailToBuildWithInvalidCleanRegex() {
        // Given
        ResourceDefinition.Builder builder = storageAccount().toBuilder().cleanRegex("[a-z");

        // When / Then
        assertThatThrownBy(builder::build)
                .isInstanceOfSatisfying(InvalidPatternException.class, e -> {
                    assertThat(e.getResourceType()).isEqualTo("test_storage_account");
                    assertThat(e.getPattern()).isEqualTo("[a-z");
                })
                .hasMessage("Invalid clean regex for resource type test_storage_account: \"[a-z\"")
                .hasCauseInstanceOf(PatternSyntaxException.class);
    }

    @Test
    void shouldFailToBuildWithInvalidValidationRegex() {
        // Given
        ResourceDefinition.Builder builder = storageAccount().toBuilder().validationRegex("^(abc$");

        // When / Then
        assertThatThrownBy(builder::build)
                .isInstanceOf(InvalidPatternException.class)
                .hasMessage("Invalid validation regex for resource type test_storage_account: \"^(abc$\"");
    }

    @Test
    void shouldFailToBuildWhenMaxLengthIsBelowMinLength() {
        // Given
        ResourceDefinition.Builder builder = storageAccount().toBuilder().minLength(10).maxLength(5);

        // When / Then
        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("test_storage_account");
    }

    @Test
    void shouldFailToBuildWithNegativeMinLength() {
        // Given
        ResourceDefinition.Builder builder = storageAccount().toBuilder().minLength(-1);

        // When / Then
        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFailToBuildWithNoResourceType() {
        // Given
        ResourceDefinition.Builder builder = storageAccount().toBuilder().resourceType(null);

        // When / Then
        assertThatThrownBy(builder::build)
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void shouldCopyToBuilder() {
        // Given
        ResourceDefinition definition = storageAccount();

        // When
        ResourceDefinition copy = definition.toBuilder().build();

        // Then
        assertThat(copy).isEqualTo(definition);
    }
}
