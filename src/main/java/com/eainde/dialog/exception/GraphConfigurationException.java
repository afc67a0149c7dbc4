package com.eainde.dialog.exception;

/**
 * The graph topology is inconsistent. Raised while the graph is being defined, never while it runs.
 */
public class GraphConfigurationException extends DialogRouterException {

    public GraphConfigurationException(String message) {
        super(message);
    }

    public GraphConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
