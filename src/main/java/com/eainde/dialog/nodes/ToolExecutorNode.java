package com.eainde.dialog.nodes;

import com.eainde.dialog.message.Message;
import com.eainde.dialog.message.ToolCall;
import com.eainde.dialog.state.SessionState;
import com.eainde.dialog.thread.ExternalCallGuard;
import com.eainde.dialog.tools.ToolRegistry;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executes the tool calls of the last message, one tool result per call.
 *
 * <p>This node never fails. If any call raises (or times out), every call of the triggering message is
 * answered with an error description instead, so the agent gets a turn to correct itself.</p>
 */
@Log4j2
public class ToolExecutorNode implements AsyncNodeAction<SessionState> {

    private final String name;
    private final ToolRegistry registry;
    private final ExternalCallGuard callGuard;
    private final Duration timeout;

    public ToolExecutorNode(String name, ToolRegistry registry, ExternalCallGuard callGuard, Duration timeout) {
        this.name = name;
        this.registry = registry;
        this.callGuard = callGuard;
        this.timeout = timeout;
    }

    public ToolRegistry registry() {
        return registry;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(SessionState state) {
        List<ToolCall> toolCalls = state.lastMessage()
                .map(Message::toolCalls)
                .orElse(List.of());

        return CompletableFuture.completedFuture(SessionState.appendMessages(execute(toolCalls)));
    }

    List<Message> execute(List<ToolCall> toolCalls) {
        List<Message> results = new ArrayList<>(toolCalls.size());
        try {
            for (ToolCall call : toolCalls) {
                String output = callGuard.call("tool " + call.name(), timeout, () -> registry.execute(call));
                results.add(Message.toolResult(call, output));
            }
            return results;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("[{}] tool execution failed, returning error to the agent: {}", name, e.toString());
            return fallback(toolCalls, e);
        }
    }

    static List<Message> fallback(List<ToolCall> toolCalls, Exception error) {
        String content = "Error: " + describe(error) + "\n please fix your mistakes.";
        List<Message> messages = new ArrayList<>(toolCalls.size());
        for (ToolCall call : toolCalls) {
            messages.add(Message.toolResult(call, content));
        }
        return messages;
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + "('" + (message == null ? "" : message) + "')";
    }
}
