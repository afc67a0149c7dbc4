package com.eainde.dialog.tools;

import com.eainde.dialog.message.ToolCall;
import com.eainde.dialog.support.StubTool;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRegistryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void execute_shouldPassParsedArguments_whenToolIsRegistered() throws Exception {
        // Arrange
        StubTool tool = StubTool.returning("write_file", "ok");
        ToolRegistry registry = new ToolRegistry(List.of(tool), objectMapper);

        // Act
        String result = registry.execute(new ToolCall("c1", "write_file", "{\"path\":\"a.txt\",\"content\":\"x\"}"));

        // Assert
        assertThat(result).isEqualTo("ok");
        assertThat(tool.calls()).singleElement()
                .satisfies(args -> assertThat(args.get("content").asText()).isEqualTo("x"));
    }

    @Test
    void execute_shouldSerializeStructuredResult_whenToolReturnsObject() throws Exception {
        // Arrange
        ToolRegistry registry = new ToolRegistry(
                List.of(StubTool.returning("stats", Map.of("files", 3))), objectMapper);

        // Act
        String result = registry.execute(ToolCall.of("c1", "stats"));

        // Assert
        assertThat(result).isEqualTo("{\"files\":3}");
    }

    @Test
    void execute_shouldThrow_whenToolIsUnknown() {
        // Arrange
        ToolRegistry registry = ToolRegistry.empty(objectMapper);

        // Act & Assert
        assertThatThrownBy(() -> registry.execute(ToolCall.of("c1", "missing")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown tool 'missing'");
    }

    @Test
    void execute_shouldThrow_whenArgumentsAreMalformed() {
        // Arrange
        ToolRegistry registry = new ToolRegistry(List.of(StubTool.returning("read_file", "")), objectMapper);

        // Act & Assert
        assertThatThrownBy(() -> registry.execute(new ToolCall("c1", "read_file", "{not json")))
                .isInstanceOf(JsonProcessingException.class);
    }

    @Test
    void constructor_shouldReject_whenNamesCollide() {
        // Act & Assert
        assertThatThrownBy(() -> new ToolRegistry(
                List.of(StubTool.returning("read_file", ""), StubTool.returning("read_file", "")), objectMapper))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate tool name");
    }

    @Test
    void specifications_shouldFollowRegistrationOrder() {
        // Arrange
        ToolRegistry registry = new ToolRegistry(
                List.of(StubTool.returning("b", ""), StubTool.returning("a", "")), objectMapper);

        // Act & Assert
        assertThat(registry.specifications()).extracting(spec -> spec.name()).containsExactly("b", "a");
        assertThat(registry.names()).containsExactly("b", "a");
    }
}
