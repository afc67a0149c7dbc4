package com.eainde.dialog.tools;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.agent.tool.ToolSpecification;

/**
 * A tool an agent can call.
 *
 * <p>Unlike a hand-off, a tool performs a real action. Implementations signal failure by throwing;
 * the tool node turns the failure into a message the agent can react to.</p>
 */
public interface AgentTool {

    /** Schema sent to the model so it knows how to invoke the tool. */
    ToolSpecification specification();

    default String name() {
        return specification().name();
    }

    /**
     * @param arguments parsed JSON arguments, an empty object when the call carried none
     * @return result rendered back to the model; strings are passed through, other values as JSON
     */
    Object execute(JsonNode arguments) throws Exception;
}
