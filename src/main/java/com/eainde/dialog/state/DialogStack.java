package com.eainde.dialog.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reducer of the {@code dialog_state} channel. Only ever appends to or removes from the tail.
 */
public final class DialogStack {

    private DialogStack() {}

    public static List<AgentContext> reduce(List<AgentContext> stack, DialogStackOperation operation) {
        List<AgentContext> current = stack == null ? Collections.emptyList() : stack;
        if (operation == null) {
            return new ArrayList<>(current);
        }
        switch (operation.kind()) {
            case PUSH: {
                List<AgentContext> pushed = new ArrayList<>(current.size() + 1);
                pushed.addAll(current);
                pushed.add(operation.value());
                return pushed;
            }
            case POP:
                return current.isEmpty()
                        ? new ArrayList<>()
                        : new ArrayList<>(current.subList(0, current.size() - 1));
            case NO_OP:
            default:
                return new ArrayList<>(current);
        }
    }

    /**
     * Channel adapter: the stored value is the stack, updates are {@link DialogStackOperation}s.
     */
    @SuppressWarnings("unchecked")
    static Object merge(Object stored, Object update) {
        List<AgentContext> stack = stored instanceof List<?> list ? (List<AgentContext>) list : Collections.emptyList();
        if (update == null) {
            return new ArrayList<>(stack);
        }
        if (update instanceof DialogStackOperation operation) {
            return reduce(stack, operation);
        }
        throw new IllegalArgumentException("Unsupported dialog stack update: " + update.getClass().getName());
    }
}
