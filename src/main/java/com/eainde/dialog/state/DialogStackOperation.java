package com.eainde.dialog.state;

import java.io.Serializable;
import java.util.Objects;

/**
 * Update applied to the dialog stack by a node: leave it alone, remove the tail, or append.
 */
public final class DialogStackOperation implements Serializable {

    public enum Kind { NO_OP, POP, PUSH }

    private static final DialogStackOperation NO_OP = new DialogStackOperation(Kind.NO_OP, null);
    private static final DialogStackOperation POP = new DialogStackOperation(Kind.POP, null);

    private final Kind kind;
    private final AgentContext value;

    private DialogStackOperation(Kind kind, AgentContext value) {
        this.kind = kind;
        this.value = value;
    }

    public static DialogStackOperation noOp() {
        return NO_OP;
    }

    public static DialogStackOperation pop() {
        return POP;
    }

    public static DialogStackOperation push(AgentContext value) {
        return new DialogStackOperation(Kind.PUSH, Objects.requireNonNull(value, "value"));
    }

    public Kind kind() {
        return kind;
    }

    /** Pushed agent; {@code null} unless {@link #kind()} is {@link Kind#PUSH}. */
    public AgentContext value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DialogStackOperation other)) return false;
        return kind == other.kind && value == other.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == Kind.PUSH ? "PUSH(" + value.nodeName() + ")" : kind.name();
    }
}
