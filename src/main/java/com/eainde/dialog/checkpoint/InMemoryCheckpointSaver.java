package com.eainde.dialog.checkpoint;

import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps checkpoints in process memory, newest first per session.
 * <p>
 * History per session is capped; the oldest checkpoints are dropped first.
 * </p>
 */
@Log4j2
public class InMemoryCheckpointSaver implements BaseCheckpointSaver {

    public static final int DEFAULT_MAX_HISTORY = 100;

    private final Map<String, LinkedList<Checkpoint>> storage = new ConcurrentHashMap<>();
    private final int maxHistory;

    public InMemoryCheckpointSaver() {
        this(DEFAULT_MAX_HISTORY);
    }

    public InMemoryCheckpointSaver(int maxHistory) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be at least 1");
        }
        this.maxHistory = maxHistory;
    }

    @Override
    public Collection<Checkpoint> list(RunnableConfig config) {
        LinkedList<Checkpoint> checkpoints = history(config);
        if (checkpoints == null) {
            return List.of();
        }
        synchronized (checkpoints) {
            return List.copyOf(checkpoints);
        }
    }

    @Override
    public Optional<Checkpoint> get(RunnableConfig config) {
        LinkedList<Checkpoint> checkpoints = history(config);
        if (checkpoints == null) {
            return Optional.empty();
        }
        synchronized (checkpoints) {
            if (config.checkPointId().isPresent()) {
                String checkpointId = config.checkPointId().get();
                return checkpoints.stream()
                        .filter(cp -> cp.getId().equals(checkpointId))
                        .findFirst();
            }
            return Optional.ofNullable(checkpoints.peekFirst());
        }
    }

    @Override
    public RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) {
        String threadId = config.threadId().orElseThrow(() ->
                new IllegalArgumentException("Thread ID is required")
        );

        LinkedList<Checkpoint> checkpoints = storage.computeIfAbsent(threadId, k -> new LinkedList<>());
        synchronized (checkpoints) {
            int existing = indexOf(checkpoints, checkpoint.getId());
            if (existing >= 0) {
                checkpoints.set(existing, checkpoint);
            } else {
                checkpoints.addFirst(checkpoint);
                while (checkpoints.size() > maxHistory) {
                    checkpoints.removeLast();
                }
            }
        }
        log.debug("Checkpoint {} stored (node={}, next={})",
                checkpoint.getId(), checkpoint.getNodeId(), checkpoint.getNextNodeId());

        return RunnableConfig.builder()
                .threadId(threadId)
                .checkPointId(checkpoint.getId())
                .build();
    }

    @Override
    public Tag release(RunnableConfig config) throws Exception {
        // sessions are long lived; history stays until the process ends
        return null;
    }

    private LinkedList<Checkpoint> history(RunnableConfig config) {
        return config.threadId().map(storage::get).orElse(null);
    }

    private static int indexOf(List<Checkpoint> checkpoints, String id) {
        List<Checkpoint> snapshot = new ArrayList<>(checkpoints);
        for (int i = 0; i < snapshot.size(); i++) {
            if (snapshot.get(i).getId().equals(id)) {
                return i;
            }
        }
        return -1;
    }
}
