package com.eainde.dialog.model;

import com.eainde.dialog.exception.SessionExecutionException;
import com.eainde.dialog.message.Message;
import com.eainde.dialog.thread.ExternalCallGuard;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link AgentModel} backed by a LangChain4j {@link ChatModel}: prepends the agent's system prompt,
 * binds its tool specifications and puts a deadline on the call.
 */
@Log4j2
public class LangChain4jAgentModel implements AgentModel {

    private final String agentName;
    private final ChatModel chatModel;
    private final String systemPrompt;
    private final List<ToolSpecification> toolSpecifications;
    private final ExternalCallGuard callGuard;
    private final Duration timeout;

    public LangChain4jAgentModel(String agentName,
                                 ChatModel chatModel,
                                 String systemPrompt,
                                 List<ToolSpecification> toolSpecifications,
                                 ExternalCallGuard callGuard,
                                 Duration timeout) {
        this.agentName = agentName;
        this.chatModel = chatModel;
        this.systemPrompt = systemPrompt;
        this.toolSpecifications = List.copyOf(toolSpecifications);
        this.callGuard = callGuard;
        this.timeout = timeout;
    }

    @Override
    public Message invoke(List<Message> history) {
        List<ChatMessage> messages = new ArrayList<>(history.size() + 1);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        messages.addAll(MessageMapper.toChatMessages(history));

        ChatRequest request = ChatRequest.builder()
                .messages(messages)
                .toolSpecifications(toolSpecifications)
                .build();

        log.debug("[{}] invoking model with {} messages and {} tools",
                agentName, messages.size(), toolSpecifications.size());

        ChatResponse response;
        try {
            response = callGuard.call(agentName + " model call", timeout, () -> chatModel.chat(request));
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new SessionExecutionException("Model call failed for agent '" + agentName + "'", e);
        }
        return MessageMapper.fromAiMessage(response.aiMessage());
    }
}
