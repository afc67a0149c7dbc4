package com.eainde.dialog.edges;

import com.eainde.dialog.exception.RoutingException;
import com.eainde.dialog.message.Message;
import com.eainde.dialog.message.ToolCall;
import com.eainde.dialog.state.AgentContext;
import com.eainde.dialog.state.SessionState;
import com.eainde.dialog.tools.HandoffTools;
import com.eainde.dialog.workflow.NodeNames;

import java.util.LinkedHashSet;
import java.util.Set;

import static org.bsc.langgraph4j.StateGraph.END;

/**
 * Routing of a specialized agent's turn: an escalation anywhere in the tool calls leaves the agent,
 * otherwise its own tools run. A tool the agent does not own is rejected with a {@link RoutingException}.
 */
public class SpecialistRouter implements Router {

    private final AgentContext agent;
    private final Set<String> ownToolNames;

    public SpecialistRouter(AgentContext agent, Set<String> ownToolNames) {
        this.agent = agent;
        this.ownToolNames = Set.copyOf(ownToolNames);
    }

    @Override
    public String route(SessionState state) {
        Message last = state.lastMessage().orElse(null);
        if (last == null || !last.hasToolCalls()) {
            return END;
        }

        boolean escalated = last.toolCalls().stream()
                .anyMatch(call -> HandoffTools.COMPLETE_OR_ESCALATE.equals(call.name()));
        if (escalated) {
            return NodeNames.LEAVE_SKILL;
        }

        for (ToolCall call : last.toolCalls()) {
            if (!ownToolNames.contains(call.name())) {
                throw new RoutingException(agent.nodeName(), call.name());
            }
        }
        return agent.toolsNodeName();
    }

    @Override
    public Set<String> targets() {
        Set<String> targets = new LinkedHashSet<>();
        targets.add(agent.toolsNodeName());
        targets.add(NodeNames.LEAVE_SKILL);
        targets.add(END);
        return targets;
    }
}
