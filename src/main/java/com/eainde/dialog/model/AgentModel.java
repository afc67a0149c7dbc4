package com.eainde.dialog.model;

import com.eainde.dialog.message.Message;

import java.util.List;

/**
 * A language model bound to one agent's prompt and tool set.
 */
@FunctionalInterface
public interface AgentModel {

    /**
     * Produces the agent's next turn for the given history. The result may be empty; callers decide
     * whether it is acceptable.
     */
    Message invoke(List<Message> history);
}
