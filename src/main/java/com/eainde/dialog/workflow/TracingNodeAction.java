package com.eainde.dialog.workflow;

import com.eainde.dialog.state.SessionState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Decorator that logs every node execution and notifies a {@link NodeExecutionListener}.
 */
@Log4j2
class TracingNodeAction implements AsyncNodeAction<SessionState> {

    private final String nodeName;
    private final AsyncNodeAction<SessionState> delegate;
    private final NodeExecutionListener listener;

    TracingNodeAction(String nodeName, AsyncNodeAction<SessionState> delegate, NodeExecutionListener listener) {
        this.nodeName = nodeName;
        this.delegate = delegate;
        this.listener = listener;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(SessionState state) {
        log.info("Executing node [{}] (messages={}, dialogStack={})",
                nodeName, state.messages().size(), state.dialogStack());
        notifySafely(() -> listener.beforeNode(nodeName), "beforeNode");

        CompletableFuture<Map<String, Object>> result;
        try {
            result = delegate.apply(state);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }

        return result.whenComplete((update, error) -> {
            if (error != null) {
                log.warn("Node [{}] failed: {}", nodeName, error.toString());
                notifySafely(() -> listener.onNodeError(nodeName, error), "onNodeError");
            } else {
                log.info("Node [{}] completed with keys {}", nodeName, update == null ? "[]" : update.keySet());
                notifySafely(() -> listener.afterNode(nodeName, update), "afterNode");
            }
        });
    }

    private void notifySafely(Runnable callback, String phase) {
        try {
            callback.run();
        } catch (Exception e) {
            log.warn("Node listener {} failed for [{}]: {}", phase, nodeName, e.getMessage());
        }
    }
}
