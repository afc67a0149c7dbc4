package com.eainde.dialog.nodes;

import com.eainde.dialog.exception.RetryExhaustedException;
import com.eainde.dialog.message.Message;
import com.eainde.dialog.message.Role;
import com.eainde.dialog.message.ToolCall;
import com.eainde.dialog.model.AgentModel;
import com.eainde.dialog.state.SessionState;
import com.eainde.dialog.support.ScriptedAgentModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentNodeTest {

    @Mock
    private AgentModel mockModel;

    @Test
    void apply_shouldInvokeThreeTimesAndPersistOnlyValidReply_whenFirstTwoRepliesAreEmpty() throws Exception {
        // Arrange
        Message valid = Message.assistant("Here is the plan.");
        ScriptedAgentModel model = ScriptedAgentModel.replying(
                Message.assistant(""), Message.assistant(null), valid);
        AgentNode node = new AgentNode("primary_assistant", model, RetryPolicy.defaults());
        SessionState state = SessionState.of(List.of(Message.user("build me a REST API")), List.of());

        // Act
        Map<String, Object> update = node.apply(state).get();

        // Assert
        assertThat(model.invocationCount()).isEqualTo(3);
        assertThat(update).containsOnlyKeys(SessionState.MESSAGES);
        @SuppressWarnings("unchecked")
        List<Message> appended = (List<Message>) update.get(SessionState.MESSAGES);
        assertThat(appended).containsExactly(valid);
        assertThat(appended).noneMatch(m -> AgentNode.RETRY_DIRECTIVE.equals(m.content()));
    }

    @Test
    void invokeUntilUsable_shouldAppendDirectiveToWorkingCopyOnly_whenRetrying() {
        // Arrange
        ScriptedAgentModel model = ScriptedAgentModel.replying(Message.assistant(" "), Message.assistant("ok"));
        AgentNode node = new AgentNode("coder_assistant", model, RetryPolicy.defaults());
        List<Message> history = List.of(Message.user("write code"));

        // Act
        node.invokeUntilUsable(history);

        // Assert
        List<List<Message>> calls = model.invocations();
        assertThat(calls.get(0)).containsExactlyElementsOf(history);
        assertThat(calls.get(1)).hasSize(2);
        assertThat(calls.get(1).get(1).role()).isEqualTo(Role.USER);
        assertThat(calls.get(1).get(1).content()).isEqualTo(AgentNode.RETRY_DIRECTIVE);
        assertThat(history).hasSize(1);
    }

    @Test
    void invokeUntilUsable_shouldAcceptToolCallsWithoutText() {
        // Arrange
        Message handoff = Message.assistant(null, List.of(ToolCall.of("c1", "ToCoderAssistant")));
        when(mockModel.invoke(anyList())).thenReturn(handoff);
        AgentNode node = new AgentNode("primary_assistant", mockModel, RetryPolicy.defaults());

        // Act
        Message result = node.invokeUntilUsable(List.of(Message.user("code please")));

        // Assert
        assertThat(result).isSameAs(handoff);
        verify(mockModel, times(1)).invoke(anyList());
    }

    @Test
    void invokeUntilUsable_shouldReturnApology_whenAttemptsExhaustedAndPolicyApologizes() {
        // Arrange
        when(mockModel.invoke(anyList())).thenReturn(Message.assistant(""));
        RetryPolicy policy = new RetryPolicy(3, RetryPolicy.OnExhausted.APOLOGIZE, "Sorry!");
        AgentNode node = new AgentNode("tester_assistant", mockModel, policy);

        // Act
        Message result = node.invokeUntilUsable(List.of(Message.user("test it")));

        // Assert
        verify(mockModel, times(3)).invoke(anyList());
        assertThat(result.content()).isEqualTo("Sorry!");
        assertThat(result.hasToolCalls()).isFalse();
    }

    @Test
    void apply_shouldFailWithRetryExhausted_whenAttemptsExhaustedAndPolicyFails() {
        // Arrange
        when(mockModel.invoke(anyList())).thenReturn(null);
        AgentNode node = new AgentNode("architect_assistant", mockModel,
                new RetryPolicy(2, RetryPolicy.OnExhausted.FAIL, null));
        SessionState state = SessionState.of(List.of(Message.user("design")), List.of());

        // Act
        CompletableFuture<Map<String, Object>> result = node.apply(state);

        // Assert
        assertThatThrownBy(result::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(RetryExhaustedException.class);
        verify(mockModel, times(2)).invoke(anyList());
    }

    @Test
    void apply_shouldFailFuture_whenModelThrows() {
        // Arrange
        when(mockModel.invoke(anyList())).thenThrow(new IllegalStateException("connection refused"));
        AgentNode node = new AgentNode("primary_assistant", mockModel, RetryPolicy.defaults());

        // Act
        CompletableFuture<Map<String, Object>> result = node.apply(SessionState.of(List.of(), List.of()));

        // Assert
        assertThat(result).isCompletedExceptionally();
    }

    @Test
    void retryPolicy_shouldReject_whenMaxAttemptsBelowOne() {
        // Act & Assert
        assertThatThrownBy(() -> new RetryPolicy(0, RetryPolicy.OnExhausted.FAIL, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
