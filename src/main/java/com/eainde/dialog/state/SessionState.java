package com.eainde.dialog.state;

import com.eainde.dialog.message.Message;
import com.eainde.dialog.message.MessageLog;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persisted state of one conversation thread: the message log plus the stack of active specialized agents.
 */
public class SessionState extends AgentState {

    public static final String MESSAGES = "messages";
    public static final String DIALOG_STATE = "dialog_state";

    public static final Map<String, Channel<?>> SCHEMA = Map.of(
            MESSAGES, Channels.<List<Message>>base(MessageLog::append, ArrayList::new),
            DIALOG_STATE, Channels.<Object>base(DialogStack::merge, ArrayList::new)
    );

    public SessionState(Map<String, Object> initData) {
        super(initData);
    }

    public static SessionState of(List<Message> messages, List<AgentContext> dialogStack) {
        Map<String, Object> data = new HashMap<>();
        data.put(MESSAGES, new ArrayList<>(messages));
        data.put(DIALOG_STATE, new ArrayList<>(dialogStack));
        return new SessionState(data);
    }

    public List<Message> messages() {
        return this.<List<Message>>value(MESSAGES).orElse(List.of());
    }

    public List<AgentContext> dialogStack() {
        return this.<List<AgentContext>>value(DIALOG_STATE).orElse(List.of());
    }

    public Optional<Message> lastMessage() {
        List<Message> messages = messages();
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(messages.size() - 1));
    }

    /**
     * Agent owning the conversation; empty means the coordinator.
     */
    public Optional<AgentContext> activeAgent() {
        List<AgentContext> stack = dialogStack();
        return stack.isEmpty() ? Optional.empty() : Optional.of(stack.get(stack.size() - 1));
    }

    // Helpers for node updates
    public static Map<String, Object> appendMessages(List<Message> messages) {
        return Map.of(MESSAGES, messages);
    }

    public static Map<String, Object> appendMessages(List<Message> messages, DialogStackOperation operation) {
        return Map.of(MESSAGES, messages, DIALOG_STATE, operation);
    }
}
