package com.eainde.dialog.workflow;

import com.eainde.dialog.state.SessionState;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.Objects;

public record NodeDefinition(String name, AsyncNodeAction<SessionState> action) {

    public NodeDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(action, "action");
    }

    public static NodeDefinition of(String name, AsyncNodeAction<SessionState> action) {
        return new NodeDefinition(name, action);
    }
}
