package com.eainde.dialog.exception;

/**
 * A router met a tool call it cannot classify. Fatal to the current turn.
 */
public class RoutingException extends DialogRouterException {

    private final String sourceNode;
    private final String toolName;

    public RoutingException(String sourceNode, String toolName) {
        super("Cannot route tool call '" + toolName + "' emitted by node '" + sourceNode + "'");
        this.sourceNode = sourceNode;
        this.toolName = toolName;
    }

    public String getSourceNode() {
        return sourceNode;
    }

    public String getToolName() {
        return toolName;
    }
}
