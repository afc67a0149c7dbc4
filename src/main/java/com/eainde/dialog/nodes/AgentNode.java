package com.eainde.dialog.nodes;

import com.eainde.dialog.exception.RetryExhaustedException;
import com.eainde.dialog.message.Message;
import com.eainde.dialog.model.AgentModel;
import com.eainde.dialog.state.SessionState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs one agent turn.
 *
 * <p>The model is re-invoked while it answers with neither text nor tool calls. Each retry appends a
 * directive to a working copy of the history; only the accepted reply is merged into the session, so
 * directives never reach the persisted log. The number of invocations is bounded by the
 * {@link RetryPolicy}.</p>
 */
@Log4j2
public class AgentNode implements AsyncNodeAction<SessionState> {

    static final String RETRY_DIRECTIVE = "Respond with a real output.";

    private final String name;
    private final AgentModel model;
    private final RetryPolicy retryPolicy;

    public AgentNode(String name, AgentModel model, RetryPolicy retryPolicy) {
        this.name = name;
        this.model = model;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(SessionState state) {
        try {
            Message reply = invokeUntilUsable(state.messages());
            return CompletableFuture.completedFuture(SessionState.appendMessages(List.of(reply)));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    Message invokeUntilUsable(List<Message> history) {
        List<Message> workingCopy = new ArrayList<>(history);

        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            Message result = model.invoke(List.copyOf(workingCopy));
            if (isUsable(result)) {
                if (attempt > 1) {
                    log.info("[{}] usable output after {} attempts", name, attempt);
                }
                return result;
            }
            log.warn("[{}] empty model output on attempt {}/{}, re-prompting", name, attempt, retryPolicy.maxAttempts());
            workingCopy.add(Message.user(RETRY_DIRECTIVE));
        }

        if (retryPolicy.onExhausted() == RetryPolicy.OnExhausted.FAIL) {
            throw new RetryExhaustedException(name, retryPolicy.maxAttempts());
        }
        log.error("[{}] no usable output after {} attempts, replying with apology", name, retryPolicy.maxAttempts());
        return Message.assistant(retryPolicy.apology());
    }

    static boolean isUsable(Message message) {
        return message != null && (message.hasToolCalls() || message.hasText());
    }
}
