package com.eainde.dialog.tools;

import com.eainde.dialog.state.AgentContext;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Schemas of the control-transfer tools. They are routed by the graph, never executed.
 */
public final class HandoffTools {

    public static final String COMPLETE_OR_ESCALATE = "CompleteOrEscalate";

    private HandoffTools() {}

    public static ToolSpecification handoffTo(AgentContext agent) {
        return ToolSpecification.builder()
                .name(agent.handoffToolName())
                .description(describe(agent))
                .parameters(JsonObjectSchema.builder()
                        .addStringProperty("request", "Any necessary followup questions the "
                                + agent.label().toLowerCase() + " should clarify before proceeding.")
                        .required("request")
                        .build())
                .build();
    }

    public static List<ToolSpecification> allHandoffs() {
        return Arrays.stream(AgentContext.values())
                .map(HandoffTools::handoffTo)
                .collect(Collectors.toList());
    }

    public static ToolSpecification completeOrEscalate() {
        return ToolSpecification.builder()
                .name(COMPLETE_OR_ESCALATE)
                .description("A tool to mark the current task as completed and/or to escalate control of the dialog "
                        + "to the main assistant, who can re-route the dialog based on the user's needs.")
                .parameters(JsonObjectSchema.builder()
                        .addBooleanProperty("cancel", "True when the task is finished or cannot be handled here.")
                        .addStringProperty("reason", "Why control is handed back, e.g. 'I have fully completed the task.'")
                        .required("reason")
                        .build())
                .build();
    }

    private static String describe(AgentContext agent) {
        switch (agent) {
            case ARCHITECT:
                return "Transfers work to a specialized assistant to handle project structure and directory creation";
            case CODER:
                return "Transfers work to a specialized assistant to handle code writing into files previously "
                        + "created from Architect Assistant";
            case TESTER:
                return "Transfers work to a specialized assistant to handle unittest writing for the code "
                        + "previously written from Coder Assistant";
            default:
                throw new IllegalArgumentException("Unknown agent: " + agent);
        }
    }
}
