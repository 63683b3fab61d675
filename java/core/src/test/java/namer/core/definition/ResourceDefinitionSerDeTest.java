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

import com.google.gson.JsonParseException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static namer.core.definition.ResourceDefinitionTestHelper.resourceGroup;
import static namer.core.definition.ResourceDefinitionTestHelper.storageAccount;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ResourceDefinitionSerDeTest {

    private final ResourceDefinitionSerDe serDe = new ResourceDefinitionSerDe();

    @Test
    void shouldReadDefinitionFromJson() {
        // Given
        String json = "[{" +
                "\"name\":\"test_storage_account\"," +
                "\"alias\":\"tst\"," +
                "\"slug\":\"st\"," +
                "\"min_length\":3," +
                "\"max_length\":24," +
                "\"lowercase\":true," +
                "\"regex\":\"[^0-9a-z]\"," +
                "\"validation_regex\":\"^[a-z0-9]{3,24}$\"," +
                "\"dashes\":false," +
                "\"scope\":\"global\"" +
                "}]";

        // When / Then
        assertThat(serDe.fromJson(json)).containsExactly(storageAccount());
    }

    @Test
    void shouldReadDefinitionFromStream() {
        // Given
        String json = serDe.toJson(List.of(storageAccount(), resourceGroup()), false);

        // When / Then
        assertThat(serDe.fromJson(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))))
                .containsExactly(storageAccount(), resourceGroup());
    }

    @Test
    void shouldWriteAndReadPrettyPrintedJson() {
        // Given
        String json = serDe.toJson(List.of(resourceGroup()), true);

        // When / Then
        assertThat(json).contains("\"validation_regex\": \"^[a-zA-Z0-9._()\\\\-]{0,89}[a-zA-Z0-9_()\\\\-]$\"");
        assertThat(serDe.fromJson(json)).containsExactly(resourceGroup());
    }

    @Test
    void shouldUnescapeRegexWrappedInQuotes() {
        // Given
        String json = "[{\"name\":\"quoted_type\",\"max_length\":10," +
                "\"regex\":\"\\\"[^a-z\\\\\\\\-]\\\"\"," +
                "\"validation_regex\":\"\\\"^[a-z\\\\\\\\-]{1,10}$\\\"\"}]";

        // When
        ResourceDefinition definition = serDe.fromJson(json).get(0);

        // Then
        assertThat(definition.getCleanRegex()).isEqualTo("[^a-z\\-]");
        assertThat(definition.getValidationRegex()).isEqualTo("^[a-z\\-]{1,10}$");
    }

    @Test
    void shouldLeaveRegexNotWrappedInQuotesUnchanged() {
        assertThat(ResourceDefinitionSerDe.unquoteRegex("^[a-z\\-]{1,10}$")).isEqualTo("^[a-z\\-]{1,10}$");
        assertThat(ResourceDefinitionSerDe.unquoteRegex("\"")).isEqualTo("\"");
        assertThat(ResourceDefinitionSerDe.unquoteRegex("")).isEmpty();
        assertThat(ResourceDefinitionSerDe.unquoteRegex(null)).isNull();
    }

    @Test
    void shouldUnquoteEscapedCharacters() {
        assertThat(ResourceDefinitionSerDe.unquoteRegex("\"^[a-z\\\\-]\\\"$\""))
                .isEqualTo("^[a-z\\-]\"$");
    }

    @Test
    void shouldFailWhenRegexCannotBeCompiled() {
        // Given
        String json = "[{\"name\":\"bad_type\",\"max_length\":10,\"regex\":\"[a-z\"}]";

        // When / Then
        assertThatThrownBy(() -> serDe.fromJson(json))
                .isInstanceOfSatisfying(InvalidPatternException.class,
                        e -> assertThat(e.getResourceType()).isEqualTo("bad_type"));
    }

    @Test
    void shouldFailWhenNameIsMissing() {
        // Given
        String json = "[{\"slug\":\"x\",\"max_length\":10}]";

        // When / Then
        assertThatThrownBy(() -> serDe.fromJson(json))
                .isInstanceOf(JsonParseException.class)
                .hasMessage("Resource definition has no name");
    }

    @Test
    void shouldFailWhenJsonIsEmpty() {
        assertThatThrownBy(() -> serDe.fromJson(""))
                .isInstanceOf(JsonParseException.class);
    }
}
