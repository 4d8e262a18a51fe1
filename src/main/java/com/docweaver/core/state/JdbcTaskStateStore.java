package com.docweaver.core.state;

import com.docweaver.core.graph.PipelineGraph;
import com.docweaver.core.model.GenerationRequest;
import com.docweaver.core.model.PipelineTask;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link TaskStateStore}.
 * <p>
 * Each task is one row in {@code docweaver_tasks}, holding its full snapshot as JSON plus
 * a few denormalized columns for listing. {@link #apply} reads the row with
 * {@code SELECT ... FOR UPDATE} inside a transaction, so writers to the same task are
 * serialized even across processes.
 * <p>
 * Rows carry the instance id of the service that created them, so instances sharing the
 * table can tell their own unfinished tasks apart from each other's. The table is created by
 * {@link #createTables()}.
 */
public class JdbcTaskStateStore implements TaskStateStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskStateStore.class);

    private static final String TABLE_NAME = "docweaver_tasks";

    public static final String DEFAULT_OWNER = "docweaver";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                task_id     VARCHAR(64) PRIMARY KEY,
                owner       VARCHAR(128) NOT NULL,
                topic       TEXT NOT NULL,
                status      VARCHAR(16) NOT NULL,
                snapshot    TEXT NOT NULL,
                created_at  TIMESTAMP NOT NULL,
                updated_at  TIMESTAMP NOT NULL
            )
            """.formatted(TABLE_NAME);

    // Tables created before rows carried an owner.
    private static final String ADD_OWNER_SQL = """
            ALTER TABLE %s ADD COLUMN IF NOT EXISTS owner VARCHAR(128) NOT NULL DEFAULT '%s'
            """.formatted(TABLE_NAME, DEFAULT_OWNER);

    private static final String INSERT_SQL = """
            INSERT INTO %s (task_id, owner, topic, status, snapshot, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (task_id) DO NOTHING
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT snapshot FROM %s WHERE task_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_FOR_UPDATE_SQL = """
            SELECT snapshot FROM %s WHERE task_id = ? FOR UPDATE
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT snapshot FROM %s ORDER BY created_at DESC, task_id
            """.formatted(TABLE_NAME);

    private static final String SELECT_OWNED_UNFINISHED_SQL = """
            SELECT snapshot FROM %s WHERE owner = ? AND status NOT IN ('COMPLETED', 'FAILED')
            ORDER BY created_at, task_id
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s SET status = ?, snapshot = ?, updated_at = ? WHERE task_id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final PipelineGraph graph;
    private final String owner;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcTaskStateStore(DataSource dataSource, PipelineGraph graph) {
        this(dataSource, graph, DEFAULT_OWNER);
    }

    public JdbcTaskStateStore(DataSource dataSource, PipelineGraph graph, String owner) {
        this(dataSource, graph, owner, Clock.systemUTC());
    }

    public JdbcTaskStateStore(DataSource dataSource, PipelineGraph graph, String owner, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.graph = graph;
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Creates the task table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement create = conn.prepareStatement(CREATE_TABLE_SQL);
             PreparedStatement addOwner = conn.prepareStatement(ADD_OWNER_SQL)) {
            create.execute();
            addOwner.execute();
            log.info("Task table '{}' ensured (instance id '{}')", TABLE_NAME, owner);
        }
    }

    @Override
    public PipelineTask create(GenerationRequest request) {
        Instant now = clock.instant();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            while (true) {
                PipelineTask task = TaskTransitions.newTask(TaskTransitions.nextTaskId(now), request, graph, now);
                stmt.setString(1, task.id());
                stmt.setString(2, owner);
                stmt.setString(3, task.topic());
                stmt.setString(4, task.status().name());
                stmt.setString(5, serialize(task));
                stmt.setTimestamp(6, Timestamp.from(task.createdAt()));
                stmt.setTimestamp(7, Timestamp.from(task.updatedAt()));
                if (stmt.executeUpdate() == 1) {
                    log.debug("Created task {} for topic '{}'", task.id(), task.topic());
                    return task;
                }
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to create task for topic '" + request.topic() + "'", e);
        }
    }

    @Override
    public Optional<PipelineTask> get(String taskId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(deserialize(rs.getString("snapshot")));
                }
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to read task " + taskId, e);
        }
        return Optional.empty();
    }

    @Override
    public List<PipelineTask> list() {
        List<PipelineTask> tasks = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                tasks.add(deserialize(rs.getString("snapshot")));
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to list tasks", e);
        }
        return tasks;
    }

    @Override
    public List<PipelineTask> listOwnedUnfinished() {
        List<PipelineTask> tasks = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_OWNED_UNFINISHED_SQL)) {
            stmt.setString(1, owner);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    tasks.add(deserialize(rs.getString("snapshot")));
                }
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to list unfinished tasks of instance '" + owner + "'", e);
        }
        return tasks;
    }

    @Override
    public PipelineTask apply(String taskId, TaskTransition transition) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                PipelineTask current = lockForUpdate(conn, taskId);
                if (current.isTerminal()) {
                    log.debug("Ignoring {} on terminal task {} ({})", transition.describe(), taskId,
                            current.status());
                    conn.commit();
                    return current;
                }
                PipelineTask updated = TaskTransitions.apply(current, transition, graph, clock.instant());
                if (updated != current) {
                    try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
                        stmt.setString(1, updated.status().name());
                        stmt.setString(2, serialize(updated));
                        stmt.setTimestamp(3, Timestamp.from(updated.updatedAt()));
                        stmt.setString(4, taskId);
                        stmt.executeUpdate();
                    }
                }
                conn.commit();
                return updated;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to apply " + transition.describe() + " to task " + taskId, e);
        }
    }

    private PipelineTask lockForUpdate(Connection conn, String taskId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_FOR_UPDATE_SQL)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new TaskNotFoundException(taskId);
                }
                return deserialize(rs.getString("snapshot"));
            }
        }
    }

    private String serialize(PipelineTask task) {
        try {
            return objectMapper.writeValueAsString(task);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task " + task.id(), e);
        }
    }

    private PipelineTask deserialize(String json) {
        try {
            return objectMapper.readValue(json, PipelineTask.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize task snapshot", e);
        }
    }
}
