package com.eainde.dialog.tools;

import com.eainde.dialog.message.ToolCall;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolSpecification;
import lombok.extern.log4j.Log4j2;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Name-indexed tool set bound to one agent.
 *
 * <p>Failures propagate: an unknown tool name, malformed arguments or an exception thrown by the
 * tool all surface to the caller.</p>
 */
@Log4j2
public class ToolRegistry {

    private final Map<String, AgentTool> tools;
    private final ObjectMapper objectMapper;

    public ToolRegistry(List<AgentTool> tools, ObjectMapper objectMapper) {
        Map<String, AgentTool> indexed = new LinkedHashMap<>();
        for (AgentTool tool : tools) {
            if (indexed.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalArgumentException("Duplicate tool name: " + tool.name());
            }
        }
        this.tools = Collections.unmodifiableMap(indexed);
        this.objectMapper = objectMapper;
    }

    public static ToolRegistry empty(ObjectMapper objectMapper) {
        return new ToolRegistry(List.of(), objectMapper);
    }

    public List<ToolSpecification> specifications() {
        return tools.values().stream()
                .map(AgentTool::specification)
                .collect(Collectors.toList());
    }

    public Set<String> names() {
        return tools.keySet();
    }

    public String execute(ToolCall call) throws Exception {
        AgentTool tool = tools.get(call.name());
        if (tool == null) {
            throw new IllegalArgumentException(
                    "Unknown tool '" + call.name() + "'. Available tools: " + tools.keySet());
        }

        JsonNode arguments = objectMapper.readTree(call.arguments());
        log.info("Executing tool: [{}] with args: {}", call.name(), call.arguments());

        Object result = tool.execute(arguments);
        if (result == null) {
            return "";
        }
        if (result instanceof String text) {
            return text;
        }
        return objectMapper.writeValueAsString(result);
    }
}
