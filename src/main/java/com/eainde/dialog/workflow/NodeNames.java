package com.eainde.dialog.workflow;

/**
 * Fixed node names of the dialog graph. Specialized agents derive theirs from
 * {@link com.eainde.dialog.state.AgentContext}.
 */
public final class NodeNames {

    private NodeNames() {}

    /** Coordinating agent, active whenever the dialog stack is empty. */
    public static final String PRIMARY_ASSISTANT = "primary_assistant";

    /** Executes the coordinator's own tools. */
    public static final String PRIMARY_ASSISTANT_TOOLS = "primary_assistant_tools";

    /** Shared exit handler: pops the dialog stack and hands control back to the coordinator. */
    public static final String LEAVE_SKILL = "leave_skill";
}
