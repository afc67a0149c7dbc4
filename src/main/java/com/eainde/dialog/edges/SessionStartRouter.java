package com.eainde.dialog.edges;

import com.eainde.dialog.state.AgentContext;
import com.eainde.dialog.state.SessionState;
import com.eainde.dialog.workflow.NodeNames;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Entry routing of every turn: a resumed session goes straight back to the agent on top of the
 * dialog stack, otherwise the coordinator answers.
 */
public class SessionStartRouter implements Router {

    @Override
    public String route(SessionState state) {
        return state.activeAgent()
                .map(AgentContext::nodeName)
                .orElse(NodeNames.PRIMARY_ASSISTANT);
    }

    @Override
    public Set<String> targets() {
        Set<String> targets = new LinkedHashSet<>();
        targets.add(NodeNames.PRIMARY_ASSISTANT);
        Arrays.stream(AgentContext.values()).map(AgentContext::nodeName).forEach(targets::add);
        return targets;
    }
}
