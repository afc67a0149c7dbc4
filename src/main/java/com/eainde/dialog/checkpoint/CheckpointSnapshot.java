package com.eainde.dialog.checkpoint;

import com.eainde.dialog.message.Message;
import com.eainde.dialog.state.AgentContext;
import com.eainde.dialog.state.SessionState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a session checkpoint's state.
 */
record CheckpointSnapshot(List<Message> messages, List<AgentContext> dialogState) {

    CheckpointSnapshot {
        messages = messages == null ? List.of() : List.copyOf(messages);
        dialogState = dialogState == null ? List.of() : List.copyOf(dialogState);
    }

    static CheckpointSnapshot from(Map<String, Object> state) {
        SessionState session = new SessionState(state);
        return new CheckpointSnapshot(session.messages(), session.dialogStack());
    }

    Map<String, Object> toState() {
        Map<String, Object> state = new HashMap<>();
        state.put(SessionState.MESSAGES, new ArrayList<>(messages));
        state.put(SessionState.DIALOG_STATE, new ArrayList<>(dialogState));
        return state;
    }
}
