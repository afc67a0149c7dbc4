package com.eainde.dialog.edges;

import com.eainde.dialog.state.SessionState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Decides the next node from the session state. Implementations are pure: the same state always
 * yields the same target.
 */
public interface Router extends AsyncEdgeAction<SessionState> {

    /**
     * @return name of the next node, or {@link org.bsc.langgraph4j.StateGraph#END}
     * @throws com.eainde.dialog.exception.RoutingException if the last message cannot be classified
     */
    String route(SessionState state);

    /** Every value {@link #route} can return. The graph checks them against its declared nodes. */
    Set<String> targets();

    @Override
    default CompletableFuture<String> apply(SessionState state) {
        try {
            return CompletableFuture.completedFuture(route(state));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
