package com.eainde.dialog.workflow;

import java.util.Map;

/**
 * Observes node executions of the dialog graph. Listener failures are logged and never affect the run.
 */
public interface NodeExecutionListener {

    NodeExecutionListener NONE = new NodeExecutionListener() {};

    default void beforeNode(String nodeName) {
    }

    default void afterNode(String nodeName, Map<String, Object> update) {
    }

    default void onNodeError(String nodeName, Throwable error) {
    }
}
