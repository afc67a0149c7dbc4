package com.eainde.dialog.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Stores checkpoints in a relational table so sessions survive a restart.
 * <p>
 * State is written as JSON; the newest row (highest {@code seq}) of a session is its current checkpoint.
 * </p>
 */
@Log4j2
public class JdbcCheckpointSaver implements BaseCheckpointSaver {

    static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS dialog_checkpoint (
                seq            BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                session_id     VARCHAR(255) NOT NULL,
                checkpoint_id  VARCHAR(255) NOT NULL,
                node_id        VARCHAR(255),
                next_node_id   VARCHAR(255),
                state_json     CLOB NOT NULL,
                created_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                CONSTRAINT uk_dialog_checkpoint UNIQUE (session_id, checkpoint_id)
            )
            """;

    private static final String COLUMNS = "checkpoint_id, node_id, next_node_id, state_json";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcCheckpointSaver(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void initializeSchema() {
        jdbcTemplate.execute(CREATE_TABLE);
        log.info("Checkpoint table dialog_checkpoint is ready");
    }

    @Override
    public Collection<Checkpoint> list(RunnableConfig config) {
        Optional<String> sessionId = config.threadId();
        if (sessionId.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM dialog_checkpoint WHERE session_id = ? ORDER BY seq DESC",
                checkpointMapper(),
                sessionId.get());
    }

    @Override
    public Optional<Checkpoint> get(RunnableConfig config) {
        Optional<String> sessionId = config.threadId();
        if (sessionId.isEmpty()) {
            return Optional.empty();
        }
        List<Checkpoint> rows;
        if (config.checkPointId().isPresent()) {
            rows = jdbcTemplate.query(
                    "SELECT " + COLUMNS + " FROM dialog_checkpoint WHERE session_id = ? AND checkpoint_id = ?",
                    checkpointMapper(),
                    sessionId.get(), config.checkPointId().get());
        } else {
            rows = jdbcTemplate.query(
                    "SELECT " + COLUMNS + " FROM dialog_checkpoint WHERE session_id = ? "
                            + "ORDER BY seq DESC FETCH FIRST 1 ROWS ONLY",
                    checkpointMapper(),
                    sessionId.get());
        }
        return rows.stream().findFirst();
    }

    @Override
    public RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) {
        String sessionId = config.threadId().orElseThrow(() ->
                new IllegalArgumentException("Thread ID is required")
        );
        String json = writeState(checkpoint);

        int updated = jdbcTemplate.update("""
                UPDATE dialog_checkpoint
                   SET node_id = ?, next_node_id = ?, state_json = ?, created_at = CURRENT_TIMESTAMP
                 WHERE session_id = ? AND checkpoint_id = ?
                """, checkpoint.getNodeId(), checkpoint.getNextNodeId(), json, sessionId, checkpoint.getId());
        if (updated == 0) {
            jdbcTemplate.update("""
                    INSERT INTO dialog_checkpoint (session_id, checkpoint_id, node_id, next_node_id, state_json)
                    VALUES (?, ?, ?, ?, ?)
                    """, sessionId, checkpoint.getId(), checkpoint.getNodeId(), checkpoint.getNextNodeId(), json);
        }
        log.debug("Checkpoint {} persisted (node={}, next={})",
                checkpoint.getId(), checkpoint.getNodeId(), checkpoint.getNextNodeId());

        return RunnableConfig.builder()
                .threadId(sessionId)
                .checkPointId(checkpoint.getId())
                .build();
    }

    @Override
    public Tag release(RunnableConfig config) throws Exception {
        // rows are kept; a released session can still be resumed
        return null;
    }

    private String writeState(Checkpoint checkpoint) {
        try {
            return objectMapper.writeValueAsString(CheckpointSnapshot.from(checkpoint.getState()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint " + checkpoint.getId(), e);
        }
    }

    private RowMapper<Checkpoint> checkpointMapper() {
        return (rs, rowNum) -> {
            String checkpointId = rs.getString("checkpoint_id");
            CheckpointSnapshot snapshot;
            try {
                snapshot = objectMapper.readValue(rs.getString("state_json"), CheckpointSnapshot.class);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to deserialize checkpoint " + checkpointId, e);
            }
            return Checkpoint.builder()
                    .id(checkpointId)
                    .nodeId(rs.getString("node_id"))
                    .nextNodeId(rs.getString("next_node_id"))
                    .state(snapshot.toState())
                    .build();
        };
    }
}
