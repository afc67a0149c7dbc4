package com.eainde.dialog.edges;

import com.eainde.dialog.exception.RoutingException;
import com.eainde.dialog.message.Message;
import com.eainde.dialog.message.ToolCall;
import com.eainde.dialog.state.AgentContext;
import com.eainde.dialog.state.SessionState;
import com.eainde.dialog.workflow.NodeNames;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import static org.bsc.langgraph4j.StateGraph.END;

/**
 * Routing of the coordinator's turn, based on the first tool call of its last message:
 * <ul>
 *   <li>no tool call: the turn is over ({@code END})</li>
 *   <li>a hand-off: the entry node of that agent</li>
 *   <li>one of the coordinator's own tools: its tool node</li>
 * </ul>
 * Anything else is rejected with a {@link RoutingException}.
 */
public class CoordinatorRouter implements Router {

    private final Set<String> ownToolNames;

    public CoordinatorRouter(Set<String> ownToolNames) {
        this.ownToolNames = Set.copyOf(ownToolNames);
    }

    @Override
    public String route(SessionState state) {
        Message last = state.lastMessage().orElse(null);
        if (last == null || !last.hasToolCalls()) {
            return END;
        }

        ToolCall first = last.toolCalls().get(0);
        Optional<AgentContext> handoff = AgentContext.fromHandoffTool(first.name());
        if (handoff.isPresent()) {
            return handoff.get().entryNodeName();
        }
        if (ownToolNames.contains(first.name())) {
            return NodeNames.PRIMARY_ASSISTANT_TOOLS;
        }
        throw new RoutingException(NodeNames.PRIMARY_ASSISTANT, first.name());
    }

    @Override
    public Set<String> targets() {
        Set<String> targets = new LinkedHashSet<>();
        Arrays.stream(AgentContext.values()).map(AgentContext::entryNodeName).forEach(targets::add);
        targets.add(NodeNames.PRIMARY_ASSISTANT_TOOLS);
        targets.add(END);
        return targets;
    }
}
