package com.eainde.dialog.message;

import java.io.Serializable;
import java.util.Objects;

/**
 * A structured invocation request emitted by an agent's model output.
 *
 * @param id        correlation id, unique within the emitting message
 * @param name      tool or hand-off identifier
 * @param arguments JSON text of the tool-specific payload
 */
public record ToolCall(String id, String name, String arguments) implements Serializable {

    public ToolCall {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        arguments = arguments == null || arguments.isBlank() ? "{}" : arguments;
    }

    public static ToolCall of(String id, String name) {
        return new ToolCall(id, name, "{}");
    }
}
