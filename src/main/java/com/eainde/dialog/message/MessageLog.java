package com.eainde.dialog.message;

import java.util.ArrayList;
import java.util.List;

/**
 * Merge rule of the {@code messages} channel: concatenation in arrival order.
 * No deduplication, no reordering, existing entries are never rewritten.
 */
public final class MessageLog {

    private MessageLog() {}

    public static List<Message> append(List<Message> log, List<Message> update) {
        List<Message> merged = new ArrayList<>(log == null ? 0 : log.size() + (update == null ? 0 : update.size()));
        if (log != null) {
            merged.addAll(log);
        }
        if (update != null) {
            merged.addAll(update);
        }
        return merged;
    }
}
