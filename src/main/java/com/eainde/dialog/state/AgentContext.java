package com.eainde.dialog.state;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of specialized agents that can own the conversation.
 * The coordinator is never part of this set: it is the implicit owner when the dialog stack is empty.
 */
public enum AgentContext {

    ARCHITECT("architect_assistant", "ToArchitectAssistant"),
    CODER("coder_assistant", "ToCoderAssistant"),
    TESTER("tester_assistant", "ToTesterAssistant");

    private final String nodeName;
    private final String handoffToolName;

    AgentContext(String nodeName, String handoffToolName) {
        this.nodeName = nodeName;
        this.handoffToolName = handoffToolName;
    }

    /** Graph node running this agent, also the identifier kept on the dialog stack. */
    public String nodeName() {
        return nodeName;
    }

    public String entryNodeName() {
        return "enter_" + nodeName;
    }

    public String toolsNodeName() {
        return nodeName + "_tools";
    }

    /** Name of the coordinator tool that hands the conversation to this agent. */
    public String handoffToolName() {
        return handoffToolName;
    }

    /**
     * Human readable label, e.g. {@code coder_assistant -> Coder Assistant}.
     */
    public String label() {
        StringBuilder sb = new StringBuilder();
        for (String part : nodeName.split("_")) {
            if (part.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1).toLowerCase());
        }
        return sb.toString();
    }

    public static Optional<AgentContext> fromHandoffTool(String toolName) {
        return Arrays.stream(values())
                .filter(agent -> agent.handoffToolName.equals(toolName))
                .findFirst();
    }

    public static Optional<AgentContext> fromNodeName(String nodeName) {
        return Arrays.stream(values())
                .filter(agent -> agent.nodeName.equals(nodeName))
                .findFirst();
    }
}
