package com.eainde.dialog.nodes;

import com.eainde.dialog.message.Message;
import com.eainde.dialog.message.ToolCall;
import com.eainde.dialog.state.AgentContext;
import com.eainde.dialog.state.DialogStackOperation;
import com.eainde.dialog.state.SessionState;
import com.eainde.dialog.tools.HandoffTools;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Entry transition into a specialized agent: pushes it on the dialog stack and answers the hand-off
 * tool call with the framing the agent needs to take over.
 */
@Log4j2
public class EnterAgentNode implements AsyncNodeAction<SessionState> {

    static final String NOT_EXECUTED =
            "Not executed: only the first tool call is processed when control is transferred.";

    private final AgentContext agent;

    public EnterAgentNode(AgentContext agent) {
        this.agent = agent;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(SessionState state) {
        Message trigger = state.lastMessage().orElse(null);
        if (trigger == null || !trigger.hasToolCalls()) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    agent.entryNodeName() + " reached without a hand-off tool call"));
        }

        List<ToolCall> toolCalls = trigger.toolCalls();
        List<Message> messages = new ArrayList<>(toolCalls.size());
        messages.add(Message.toolResult(toolCalls.get(0), framing(agent.label())));
        for (ToolCall extra : toolCalls.subList(1, toolCalls.size())) {
            messages.add(Message.toolResult(extra, NOT_EXECUTED));
        }

        log.info("Handing dialog over to {}", agent.nodeName());
        return CompletableFuture.completedFuture(
                SessionState.appendMessages(messages, DialogStackOperation.push(agent)));
    }

    static String framing(String label) {
        return "The assistant is now the " + label + ". Reflect on the above conversation between the primary "
                + "assistant and the user. The user's intent is unsatisfied. Use the provided tools to assist the user. "
                + "Remember, you are " + label + ", and the identification, resolution, or any other action is not "
                + "complete until after you have successfully invoked the appropriate tool. If the user changes their "
                + "mind or needs help for other tasks, call the " + HandoffTools.COMPLETE_OR_ESCALATE
                + " function to let the primary assistant take control. Do not mention who you are - just act as "
                + "the proxy for the assistant.";
    }
}
