package com.eainde.dialog.workflow;

import com.eainde.dialog.exception.GraphConfigurationException;
import com.eainde.dialog.state.SessionState;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Validated topology of a dialog graph: a node list plus an edge list.
 *
 * <p>Checked on construction, so a bad topology never reaches a running session:</p>
 * <ul>
 *   <li>node names are unique and not reserved</li>
 *   <li>{@code START} and every node have exactly one outgoing edge, and every edge source is declared</li>
 *   <li>every direct target and every value a {@link com.eainde.dialog.edges.Router} can return is a
 *       declared node or {@code END}</li>
 *   <li>every node is reachable from {@code START}</li>
 * </ul>
 */
@Log4j2
public final class GraphDefinition {

    private final Map<String, NodeDefinition> nodes;
    private final Map<String, EdgeDefinition> edges;

    private GraphDefinition(Map<String, NodeDefinition> nodes, Map<String, EdgeDefinition> edges) {
        this.nodes = nodes;
        this.edges = edges;
    }

    public static GraphDefinition of(List<NodeDefinition> nodeList, List<EdgeDefinition> edgeList) {
        Map<String, NodeDefinition> nodes = new LinkedHashMap<>();
        for (NodeDefinition node : nodeList) {
            if (node.name().isBlank() || START.equals(node.name()) || END.equals(node.name())) {
                throw new GraphConfigurationException("Invalid node name '" + node.name() + "'");
            }
            if (nodes.putIfAbsent(node.name(), node) != null) {
                throw new GraphConfigurationException("Duplicate node '" + node.name() + "'");
            }
        }

        Map<String, EdgeDefinition> edges = new LinkedHashMap<>();
        for (EdgeDefinition edge : edgeList) {
            if (!START.equals(edge.source()) && !nodes.containsKey(edge.source())) {
                throw new GraphConfigurationException("Edge source '" + edge.source() + "' is not a declared node");
            }
            if (edges.putIfAbsent(edge.source(), edge) != null) {
                throw new GraphConfigurationException("Node '" + edge.source() + "' has more than one outgoing edge");
            }
            Set<String> targets = edge.possibleTargets();
            if (targets.isEmpty()) {
                throw new GraphConfigurationException("Router of '" + edge.source() + "' declares no targets");
            }
            for (String target : targets) {
                if (!END.equals(target) && !nodes.containsKey(target)) {
                    throw new GraphConfigurationException(edge.isConditional()
                            ? "Router of '" + edge.source() + "' can return '" + target + "' which is not a declared node"
                            : "Edge '" + edge.source() + "' -> '" + target + "' targets an undeclared node");
                }
            }
        }

        if (!edges.containsKey(START)) {
            throw new GraphConfigurationException("No edge leaves START");
        }
        for (String name : nodes.keySet()) {
            if (!edges.containsKey(name)) {
                throw new GraphConfigurationException("Node '" + name + "' has no outgoing edge");
            }
        }

        Set<String> unreachable = new LinkedHashSet<>(nodes.keySet());
        unreachable.removeAll(reachableFromStart(edges));
        if (!unreachable.isEmpty()) {
            throw new GraphConfigurationException("Nodes not reachable from START: " + unreachable);
        }

        return new GraphDefinition(Collections.unmodifiableMap(nodes), Collections.unmodifiableMap(edges));
    }

    public Set<String> nodeNames() {
        return nodes.keySet();
    }

    public Optional<EdgeDefinition> edgeFrom(String source) {
        return Optional.ofNullable(edges.get(source));
    }

    /**
     * Builds the executable graph. Every node is wrapped so its execution is logged and reported to
     * {@code listener}; state is checkpointed by {@code checkpointSaver} after every step.
     */
    public CompiledGraph<SessionState> compile(BaseCheckpointSaver checkpointSaver, NodeExecutionListener listener) {
        NodeExecutionListener effectiveListener = listener == null ? NodeExecutionListener.NONE : listener;
        try {
            StateGraph<SessionState> graph = new StateGraph<>(SessionState.SCHEMA, SessionState::new);

            for (NodeDefinition node : nodes.values()) {
                graph.addNode(node.name(), new TracingNodeAction(node.name(), node.action(), effectiveListener));
            }

            for (EdgeDefinition edge : edges.values()) {
                if (edge.isConditional()) {
                    Map<String, String> mappings = edge.possibleTargets().stream()
                            .collect(Collectors.toMap(Function.identity(), Function.identity()));
                    graph.addConditionalEdges(edge.source(), edge.router(), mappings);
                } else {
                    graph.addEdge(edge.source(), edge.target());
                }
            }

            CompileConfig config = checkpointSaver == null
                    ? CompileConfig.builder().build()
                    : CompileConfig.builder().checkpointSaver(checkpointSaver).build();

            log.info("Compiling dialog graph with {} nodes", nodes.size());
            return graph.compile(config);
        } catch (GraphStateException e) {
            throw new GraphConfigurationException("Dialog graph rejected by the graph runtime: " + e.getMessage(), e);
        }
    }

    private static Set<String> reachableFromStart(Map<String, EdgeDefinition> edges) {
        Set<String> visited = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(START);
        Map<String, Set<String>> adjacency = new HashMap<>();
        edges.forEach((source, edge) -> adjacency.put(source, edge.possibleTargets()));

        while (!pending.isEmpty()) {
            String current = pending.pop();
            for (String next : adjacency.getOrDefault(current, Set.of())) {
                if (!END.equals(next) && visited.add(next)) {
                    pending.push(next);
                }
            }
        }
        return visited;
    }
}
