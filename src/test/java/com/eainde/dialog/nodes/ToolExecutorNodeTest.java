package com.eainde.dialog.nodes;

import com.eainde.dialog.message.Message;
import com.eainde.dialog.message.Role;
import com.eainde.dialog.message.ToolCall;
import com.eainde.dialog.state.SessionState;
import com.eainde.dialog.support.StubTool;
import com.eainde.dialog.thread.ExternalCallGuard;
import com.eainde.dialog.thread.MdcAwareExecutor;
import com.eainde.dialog.tools.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ToolExecutorNodeTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void execute_shouldAnswerEachCallWithError_whenSecondToolRaises() {
        // Arrange
        StubTool first = StubTool.returning("read_file", "contents");
        StubTool second = StubTool.failing("write_file", new IOException("disk full"));
        ToolExecutorNode node = new ToolExecutorNode("coder_assistant_tools",
                new ToolRegistry(List.of(first, second), objectMapper), ExternalCallGuard.direct(), null);
        List<ToolCall> calls = List.of(
                new ToolCall("call_a", "read_file", "{\"path\":\"a.py\"}"),
                new ToolCall("call_b", "write_file", "{\"path\":\"b.py\"}"));

        // Act
        List<Message> results = node.execute(calls);

        // Assert
        assertThat(results).hasSize(2);
        assertThat(results).extracting(Message::toolCallId).containsExactly("call_a", "call_b");
        assertThat(results).allSatisfy(message -> {
            assertThat(message.role()).isEqualTo(Role.TOOL);
            assertThat(message.content())
                    .isEqualTo("Error: IOException('disk full')\n please fix your mistakes.");
        });
    }

    @Test
    void apply_shouldReturnOneResultPerCall_whenAllToolsSucceed() throws Exception {
        // Arrange
        ToolExecutorNode node = new ToolExecutorNode("primary_assistant_tools",
                new ToolRegistry(List.of(StubTool.returning("list_directory", "src/")), objectMapper),
                ExternalCallGuard.direct(), Duration.ofSeconds(5));
        SessionState state = SessionState.of(List.of(
                Message.user("what is there?"),
                Message.assistant(null, List.of(ToolCall.of("c1", "list_directory")))), List.of());

        // Act
        Map<String, Object> update = node.apply(state).get();

        // Assert
        @SuppressWarnings("unchecked")
        List<Message> results = (List<Message>) update.get(SessionState.MESSAGES);
        assertThat(results).singleElement().satisfies(message -> {
            assertThat(message.toolCallId()).isEqualTo("c1");
            assertThat(message.toolName()).isEqualTo("list_directory");
            assertThat(message.content()).isEqualTo("src/");
        });
    }

    @Test
    void execute_shouldReportUnknownTool_whenRegistryDoesNotHaveIt() {
        // Arrange
        ToolExecutorNode node = new ToolExecutorNode("coder_assistant_tools",
                ToolRegistry.empty(objectMapper), ExternalCallGuard.direct(), null);

        // Act
        List<Message> results = node.execute(List.of(ToolCall.of("c1", "delete_all")));

        // Assert
        assertThat(results).singleElement()
                .satisfies(message -> assertThat(message.content())
                        .startsWith("Error: IllegalArgumentException('Unknown tool 'delete_all'"));
    }

    @Test
    void execute_shouldReturnTimeoutError_whenToolExceedsDeadline() throws Exception {
        // Arrange
        StubTool slow = new StubTool("write_file", () -> {
            Thread.sleep(5_000);
            return "late";
        });
        try (MdcAwareExecutor executor = new MdcAwareExecutor("tool-test")) {
            ToolExecutorNode node = new ToolExecutorNode("coder_assistant_tools",
                    new ToolRegistry(List.of(slow), objectMapper),
                    new ExternalCallGuard(executor), Duration.ofMillis(100));

            // Act
            List<Message> results = node.execute(List.of(ToolCall.of("c1", "write_file")));

            // Assert
            assertThat(results).singleElement()
                    .satisfies(message -> assertThat(message.content())
                            .startsWith("Error: ExternalCallTimeoutException("));
        }
    }

    @Test
    void apply_shouldProduceNoMessages_whenLastMessageHasNoCalls() throws Exception {
        // Arrange
        ToolExecutorNode node = new ToolExecutorNode("primary_assistant_tools",
                ToolRegistry.empty(objectMapper), ExternalCallGuard.direct(), null);

        // Act
        Map<String, Object> update = node.apply(SessionState.of(List.of(Message.assistant("hi")), List.of())).get();

        // Assert
        assertThat((List<?>) update.get(SessionState.MESSAGES)).isEmpty();
    }
}
