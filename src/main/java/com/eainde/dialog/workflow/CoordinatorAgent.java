package com.eainde.dialog.workflow;

import com.eainde.dialog.nodes.AgentNode;
import com.eainde.dialog.nodes.ToolExecutorNode;

/**
 * The coordinating agent and the node executing its own tools.
 */
public record CoordinatorAgent(AgentNode agentNode, ToolExecutorNode toolNode) {
}
