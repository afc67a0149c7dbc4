package com.eainde.dialog.workflow;

import com.eainde.dialog.exception.DialogRouterException;
import com.eainde.dialog.exception.SessionExecutionException;
import com.eainde.dialog.message.Message;
import com.eainde.dialog.message.Role;
import com.eainde.dialog.state.SessionState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session entry point of the dialog graph.
 * <p>
 * Each call runs one user turn: the user's message is merged into the session's latest checkpoint,
 * the graph runs until a router reports {@code END}, and the latest assistant text is returned.
 * State is checkpointed under the session id after every node, so a session can be resumed
 * (including inside a specialized agent) after a restart.
 * </p>
 * <p>
 * Turns of the same session are serialized through a fixed set of striped locks.
 * </p>
 */
@Log4j2
public class DialogSessionEngine {

    static final String MDC_SESSION_ID = "sessionId";
    static final int LOCK_STRIPES = 64;

    private final CompiledGraph<SessionState> graph;
    private final BaseCheckpointSaver checkpointSaver;
    private final String defaultSessionId;

    private final ReentrantLock[] sessionLocks = new ReentrantLock[LOCK_STRIPES];

    public DialogSessionEngine(CompiledGraph<SessionState> graph,
                               BaseCheckpointSaver checkpointSaver,
                               String defaultSessionId) {
        this.graph = graph;
        this.checkpointSaver = checkpointSaver;
        this.defaultSessionId = defaultSessionId;
        for (int i = 0; i < sessionLocks.length; i++) {
            sessionLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Runs one user turn.
     *
     * @param sessionId session to continue or create; blank means the default session
     * @param userText  the user's message
     * @throws IllegalArgumentException if {@code userText} is blank
     * @throws DialogRouterException    if the turn failed (routing contract violation, exhausted retries, ...)
     */
    public SessionReply chat(String sessionId, String userText) {
        if (userText == null || userText.isBlank()) {
            throw new IllegalArgumentException("User message must not be blank");
        }
        String id = resolveSessionId(sessionId);
        ReentrantLock lock = lockFor(id);

        lock.lock();
        MDC.put(MDC_SESSION_ID, id);
        try {
            log.info("Session turn started");
            RunnableConfig config = RunnableConfig.builder()
                    .threadId(id)
                    .build();
            Map<String, Object> inputs = Map.of(SessionState.MESSAGES, List.of(Message.user(userText)));

            SessionState finalState = graph.invoke(inputs, config)
                    .orElseThrow(() -> new SessionExecutionException("Graph produced no state for session " + id, null));

            SessionReply reply = new SessionReply(id, latestAssistantText(finalState),
                    finalState.activeAgent().orElse(null));
            log.info("Session turn completed (messages={}, activeAgent={})",
                    finalState.messages().size(), reply.activeAgentIfAny().map(a -> a.nodeName()).orElse("primary"));
            return reply;
        } catch (RuntimeException e) {
            DialogRouterException failure = unwrap(e, id);
            log.error("Session turn failed: {}", failure.getMessage(), failure);
            throw failure;
        } finally {
            MDC.remove(MDC_SESSION_ID);
            lock.unlock();
        }
    }

    /**
     * Latest persisted state of a session, if it has ever run.
     */
    public Optional<SessionState> snapshot(String sessionId) {
        if (checkpointSaver == null) {
            return Optional.empty();
        }
        RunnableConfig config = RunnableConfig.builder()
                .threadId(resolveSessionId(sessionId))
                .build();
        return checkpointSaver.get(config)
                .map(checkpoint -> new SessionState(checkpoint.getState()));
    }

    // Striped: two sessions may share a lock, one session always maps to the same one.
    ReentrantLock lockFor(String sessionId) {
        return sessionLocks[Math.floorMod(sessionId.hashCode(), sessionLocks.length)];
    }

    String resolveSessionId(String sessionId) {
        return sessionId == null || sessionId.isBlank() ? defaultSessionId : sessionId.trim();
    }

    static String latestAssistantText(SessionState state) {
        List<Message> messages = state.messages();
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.role() == Role.ASSISTANT && message.hasText()) {
                return message.content();
            }
        }
        return "";
    }

    /**
     * The graph runtime wraps node and edge failures (CompletionException, ExecutionException, ...).
     * Report the first failure of our own hierarchy found in the cause chain.
     */
    static DialogRouterException unwrap(Throwable error, String sessionId) {
        Set<Throwable> seen = new HashSet<>();
        Throwable current = error;
        while (current != null && seen.add(current)) {
            if (current instanceof DialogRouterException routerException) {
                return routerException;
            }
            current = current.getCause();
        }
        return new SessionExecutionException("Turn failed for session '" + sessionId + "'", error);
    }
}
