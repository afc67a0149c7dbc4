package com.eainde.dialog.workflow;

import com.eainde.dialog.nodes.AgentNode;
import com.eainde.dialog.nodes.ToolExecutorNode;
import com.eainde.dialog.state.AgentContext;

/**
 * A specialized agent and the node executing its tools.
 */
public record SpecialistAgent(AgentContext context, AgentNode agentNode, ToolExecutorNode toolNode) {
}
