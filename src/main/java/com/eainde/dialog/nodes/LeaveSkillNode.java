package com.eainde.dialog.nodes;

import com.eainde.dialog.message.Message;
import com.eainde.dialog.message.ToolCall;
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
 * Exit transition shared by all specialized agents: pops the dialog stack and hands control back to
 * the coordinator.
 *
 * <p>Every tool call of the triggering message is answered so the log stays well formed: escalate
 * calls receive the resumption notice, any other call is reported as not executed. A message without
 * tool calls produces no reply.</p>
 */
@Log4j2
public class LeaveSkillNode implements AsyncNodeAction<SessionState> {

    static final String RESUMING =
            "Resuming dialog with the primary assistant. Please reflect on the past conversation and assist the user as needed.";

    static final String NOT_EXECUTED =
            "Not executed: control was returned to the primary assistant.";

    @Override
    public CompletableFuture<Map<String, Object>> apply(SessionState state) {
        List<ToolCall> toolCalls = state.lastMessage()
                .map(Message::toolCalls)
                .orElse(List.of());

        List<Message> messages = new ArrayList<>(toolCalls.size());
        for (ToolCall call : toolCalls) {
            boolean escalation = HandoffTools.COMPLETE_OR_ESCALATE.equals(call.name());
            messages.add(Message.toolResult(call, escalation ? RESUMING : NOT_EXECUTED));
        }

        log.info("Leaving {}, control returns to the primary assistant",
                state.activeAgent().map(a -> a.nodeName()).orElse("<none>"));
        return CompletableFuture.completedFuture(
                SessionState.appendMessages(messages, DialogStackOperation.pop()));
    }
}
