package com.eainde.dialog.nodes;

import com.eainde.dialog.message.Message;
import com.eainde.dialog.message.ToolCall;
import com.eainde.dialog.state.AgentContext;
import com.eainde.dialog.state.DialogStackOperation;
import com.eainde.dialog.state.SessionState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EnterAgentNodeTest {

    private final EnterAgentNode node = new EnterAgentNode(AgentContext.CODER);

    @Test
    void apply_shouldPushAgentAndAnnounceHandoff_whenTriggeredByHandoffCall() throws Exception {
        // Arrange
        SessionState state = SessionState.of(List.of(
                Message.user("build me a REST API"),
                Message.assistant(null, List.of(new ToolCall("call_7", "ToCoderAssistant", "{\"request\":\"api\"}")))),
                List.of());

        // Act
        Map<String, Object> update = node.apply(state).get();

        // Assert
        assertThat(update.get(SessionState.DIALOG_STATE)).isEqualTo(DialogStackOperation.push(AgentContext.CODER));
        @SuppressWarnings("unchecked")
        List<Message> messages = (List<Message>) update.get(SessionState.MESSAGES);
        assertThat(messages).singleElement().satisfies(message -> {
            assertThat(message.toolCallId()).isEqualTo("call_7");
            assertThat(message.content()).startsWith("The assistant is now the Coder Assistant.");
            assertThat(message.content()).contains("CompleteOrEscalate");
        });
    }

    @Test
    void apply_shouldMarkExtraCallsNotExecuted_whenSeveralCallsArePresent() throws Exception {
        // Arrange
        SessionState state = SessionState.of(List.of(Message.assistant(null, List.of(
                ToolCall.of("c1", "ToCoderAssistant"),
                ToolCall.of("c2", "ToTesterAssistant")))), List.of());

        // Act
        Map<String, Object> update = node.apply(state).get();

        // Assert
        @SuppressWarnings("unchecked")
        List<Message> messages = (List<Message>) update.get(SessionState.MESSAGES);
        assertThat(messages).extracting(Message::toolCallId).containsExactly("c1", "c2");
        assertThat(messages.get(1).content()).isEqualTo(EnterAgentNode.NOT_EXECUTED);
    }

    @Test
    void apply_shouldFail_whenLastMessageHasNoToolCall() {
        // Arrange
        SessionState state = SessionState.of(List.of(Message.assistant("plain text")), List.of());

        // Act & Assert
        assertThat(node.apply(state)).isCompletedExceptionally();
    }
}
