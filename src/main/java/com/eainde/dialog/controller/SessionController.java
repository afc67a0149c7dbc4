package com.eainde.dialog.controller;

import com.eainde.dialog.state.AgentContext;
import com.eainde.dialog.state.SessionState;
import com.eainde.dialog.workflow.DialogSessionEngine;
import com.eainde.dialog.workflow.SessionReply;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * HTTP surface over {@link DialogSessionEngine}.
 */
@Log4j2
@RestController
@RequestMapping("/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final DialogSessionEngine engine;

    @PostMapping("/{sessionId}/messages")
    public ReplyResponse send(@PathVariable String sessionId, @RequestBody MessageRequest request) {
        log.info("Incoming message for session {}", sessionId);
        SessionReply reply = engine.chat(sessionId, request == null ? null : request.text());
        return new ReplyResponse(reply.sessionId(), reply.text(),
                reply.activeAgentIfAny().map(AgentContext::nodeName).orElse(null));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionView> get(@PathVariable String sessionId) {
        return engine.snapshot(sessionId)
                .map(state -> ResponseEntity.ok(SessionView.of(sessionId, state)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    public record MessageRequest(String text) {
    }

    public record ReplyResponse(String sessionId, String reply, String activeAgent) {
    }

    public record SessionView(String sessionId, int messageCount, List<String> dialogStack, String activeAgent) {

        static SessionView of(String sessionId, SessionState state) {
            return new SessionView(
                    sessionId,
                    state.messages().size(),
                    state.dialogStack().stream().map(AgentContext::nodeName).toList(),
                    state.activeAgent().map(AgentContext::nodeName).orElse(null));
        }
    }
}
