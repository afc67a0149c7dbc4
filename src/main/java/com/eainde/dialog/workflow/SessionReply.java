package com.eainde.dialog.workflow;

import com.eainde.dialog.state.AgentContext;

import java.util.Optional;

/**
 * Outcome of one user turn.
 *
 * @param sessionId   session the turn ran in
 * @param text        latest assistant text of the session
 * @param activeAgent agent owning the conversation after the turn, {@code null} for the coordinator
 */
public record SessionReply(String sessionId, String text, AgentContext activeAgent) {

    public Optional<AgentContext> activeAgentIfAny() {
        return Optional.ofNullable(activeAgent);
    }
}
