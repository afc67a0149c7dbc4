package com.eainde.dialog.workflow;

import com.eainde.dialog.edges.CoordinatorRouter;
import com.eainde.dialog.edges.SessionStartRouter;
import com.eainde.dialog.edges.SpecialistRouter;
import com.eainde.dialog.exception.GraphConfigurationException;
import com.eainde.dialog.nodes.EnterAgentNode;
import com.eainde.dialog.nodes.LeaveSkillNode;
import com.eainde.dialog.state.AgentContext;
import com.eainde.dialog.state.SessionState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Topology of the dialog:
 * <pre>
 * START --(session start router)--> primary_assistant | &lt;agent&gt;
 * primary_assistant --(coordinator router)--> enter_&lt;agent&gt; | primary_assistant_tools | END
 * primary_assistant_tools --> primary_assistant
 * enter_&lt;agent&gt; --> &lt;agent&gt;
 * &lt;agent&gt; --(specialist router)--> &lt;agent&gt;_tools | leave_skill | END
 * &lt;agent&gt;_tools --> &lt;agent&gt;
 * leave_skill --> primary_assistant
 * </pre>
 */
public class DialogWorkflowGraph {

    private final CoordinatorAgent coordinator;
    private final Map<AgentContext, SpecialistAgent> specialists;

    public DialogWorkflowGraph(CoordinatorAgent coordinator, List<SpecialistAgent> specialists) {
        this.coordinator = coordinator;
        this.specialists = new EnumMap<>(AgentContext.class);
        for (SpecialistAgent specialist : specialists) {
            if (this.specialists.put(specialist.context(), specialist) != null) {
                throw new GraphConfigurationException("Duplicate specialist " + specialist.context());
            }
        }
        for (AgentContext context : AgentContext.values()) {
            if (!this.specialists.containsKey(context)) {
                throw new GraphConfigurationException("No agent configured for " + context.nodeName());
            }
        }
    }

    public GraphDefinition definition() {
        List<NodeDefinition> nodes = new ArrayList<>();
        List<EdgeDefinition> edges = new ArrayList<>();

        edges.add(EdgeDefinition.conditional(START, new SessionStartRouter()));

        nodes.add(NodeDefinition.of(NodeNames.PRIMARY_ASSISTANT, coordinator.agentNode()));
        nodes.add(NodeDefinition.of(NodeNames.PRIMARY_ASSISTANT_TOOLS, coordinator.toolNode()));
        nodes.add(NodeDefinition.of(NodeNames.LEAVE_SKILL, new LeaveSkillNode()));

        edges.add(EdgeDefinition.conditional(NodeNames.PRIMARY_ASSISTANT,
                new CoordinatorRouter(coordinator.toolNode().registry().names())));
        edges.add(EdgeDefinition.direct(NodeNames.PRIMARY_ASSISTANT_TOOLS, NodeNames.PRIMARY_ASSISTANT));
        edges.add(EdgeDefinition.direct(NodeNames.LEAVE_SKILL, NodeNames.PRIMARY_ASSISTANT));

        for (SpecialistAgent specialist : specialists.values()) {
            AgentContext context = specialist.context();

            nodes.add(NodeDefinition.of(context.entryNodeName(), new EnterAgentNode(context)));
            nodes.add(NodeDefinition.of(context.nodeName(), specialist.agentNode()));
            nodes.add(NodeDefinition.of(context.toolsNodeName(), specialist.toolNode()));

            edges.add(EdgeDefinition.direct(context.entryNodeName(), context.nodeName()));
            edges.add(EdgeDefinition.conditional(context.nodeName(),
                    new SpecialistRouter(context, specialist.toolNode().registry().names())));
            edges.add(EdgeDefinition.direct(context.toolsNodeName(), context.nodeName()));
        }

        return GraphDefinition.of(nodes, edges);
    }

    public CompiledGraph<SessionState> build(BaseCheckpointSaver checkpointSaver, NodeExecutionListener listener) {
        return definition().compile(checkpointSaver, listener);
    }
}
