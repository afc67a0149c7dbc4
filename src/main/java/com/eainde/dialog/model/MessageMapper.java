package com.eainde.dialog.model;

import com.eainde.dialog.message.Message;
import com.eainde.dialog.message.ToolCall;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Converts between the session's message log and LangChain4j chat messages.
 */
public final class MessageMapper {

    private MessageMapper() {}

    public static List<ChatMessage> toChatMessages(List<Message> messages) {
        List<ChatMessage> result = new ArrayList<>(messages.size());
        for (Message message : messages) {
            result.add(toChatMessage(message));
        }
        return result;
    }

    public static ChatMessage toChatMessage(Message message) {
        switch (message.role()) {
            case USER:
                return UserMessage.from(nullToEmpty(message.content()));
            case TOOL:
                return ToolExecutionResultMessage.from(
                        message.toolCallId(), nullToEmpty(message.toolName()), nullToEmpty(message.content()));
            case ASSISTANT:
            default:
                if (!message.hasToolCalls()) {
                    return AiMessage.from(nullToEmpty(message.content()));
                }
                List<ToolExecutionRequest> requests = message.toolCalls().stream()
                        .map(MessageMapper::toRequest)
                        .collect(Collectors.toList());
                return message.hasText()
                        ? AiMessage.from(message.content(), requests)
                        : AiMessage.from(requests);
        }
    }

    /**
     * Maps a model reply back. Tool calls without an id (some local models omit them) get a
     * generated one so later tool results can be correlated.
     */
    public static Message fromAiMessage(AiMessage aiMessage) {
        if (aiMessage == null) {
            return Message.assistant(null);
        }
        List<ToolCall> toolCalls = new ArrayList<>();
        if (aiMessage.hasToolExecutionRequests()) {
            for (ToolExecutionRequest request : aiMessage.toolExecutionRequests()) {
                String id = request.id() == null || request.id().isBlank()
                        ? "call_" + UUID.randomUUID()
                        : request.id();
                toolCalls.add(new ToolCall(id, request.name(), request.arguments()));
            }
        }
        return Message.assistant(aiMessage.text(), toolCalls);
    }

    private static ToolExecutionRequest toRequest(ToolCall call) {
        return ToolExecutionRequest.builder()
                .id(call.id())
                .name(call.name())
                .arguments(call.arguments())
                .build();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
