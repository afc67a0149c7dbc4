package com.eainde.dialog.message;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * One conversational turn. Immutable; the log that holds it is append-only.
 *
 * @param role       author of the turn
 * @param content    text, may be {@code null} for assistant turns that only request tools
 * @param toolCalls  tool calls requested by an assistant turn, never {@code null}
 * @param toolCallId for {@link Role#TOOL} turns, the id of the {@link ToolCall} being answered
 * @param toolName   for {@link Role#TOOL} turns, the name of the tool being answered
 */
public record Message(Role role,
                      String content,
                      List<ToolCall> toolCalls,
                      String toolCallId,
                      String toolName) implements Serializable {

    public Message {
        Objects.requireNonNull(role, "role");
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        if (role == Role.TOOL && toolCallId == null) {
            throw new IllegalArgumentException("Tool message requires a tool call id");
        }
    }

    public static Message user(String content) {
        return new Message(Role.USER, content, List.of(), null, null);
    }

    public static Message assistant(String content) {
        return new Message(Role.ASSISTANT, content, List.of(), null, null);
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return new Message(Role.ASSISTANT, content, toolCalls, null, null);
    }

    /**
     * Reply to {@code call}, correlated by its id.
     */
    public static Message toolResult(ToolCall call, String content) {
        return new Message(Role.TOOL, content, List.of(), call.id(), call.name());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public boolean hasText() {
        return content != null && !content.isBlank();
    }
}
