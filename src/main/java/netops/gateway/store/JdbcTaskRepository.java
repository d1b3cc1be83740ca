package netops.gateway.store;

import netops.gateway.model.Task;
import netops.gateway.model.TaskPriority;
import netops.gateway.model.TaskStatus;
import netops.gateway.model.TaskType;
import netops.gateway.repository.TaskRepository;
import netops.gateway.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TaskRepository, for deployments that want tasks to survive a restart.
 * Payload and result are stored as JSON text.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    INSERT INTO tasks (id, type, priority, payload, status, created_at, updated_at, completed_at,
                                       result, error, retry_count, max_retries, timeout_seconds, not_before, seq)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.type().wireName());
            ps.setString(3, task.priority().wireName());
            ps.setString(4, Jsons.toJson(task.payload()));
            ps.setString(5, task.status().wireName());
            setTimestamp(ps, 6, task.createdAt() != null ? task.createdAt() : Instant.now());
            setTimestamp(ps, 7, task.updatedAt());
            setTimestamp(ps, 8, task.completedAt());
            ps.setString(9, task.result() != null ? Jsons.toJson(task.result()) : null);
            ps.setString(10, truncate(task.error()));
            ps.setInt(11, task.retryCount());
            ps.setInt(12, task.maxRetries());
            ps.setInt(13, task.timeoutSeconds());
            setTimestamp(ps, 14, task.notBefore());
            ps.setLong(15, task.sequence());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public boolean update(Task task) {
        String sql = """
                    UPDATE tasks
                    SET status = ?, updated_at = ?, completed_at = ?, result = ?, error = ?,
                        retry_count = ?, not_before = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.status().wireName());
            setTimestamp(ps, 2, task.updatedAt());
            setTimestamp(ps, 3, task.completedAt());
            ps.setString(4, task.result() != null ? Jsons.toJson(task.result()) : null);
            ps.setString(5, truncate(task.error()));
            ps.setInt(6, task.retryCount());
            setTimestamp(ps, 7, task.notBefore());
            ps.setString(8, task.id());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} stored as {}", task.id(), task.status().wireName());
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<Task> findAll() {
        String sql = "SELECT * FROM tasks ORDER BY created_at, seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list tasks", e);
        }
    }

    @Override
    public List<Task> findByStatus(TaskStatus status) {
        String sql = "SELECT * FROM tasks WHERE status = ? ORDER BY created_at, seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.wireName());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find tasks by status: " + status, e);
        }
    }

    @Override
    public long maxSequence() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COALESCE(MAX(seq), 0) FROM tasks");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read task sequence", e);
        }
    }

    @Override
    public void deleteAll() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {
            int deleted = st.executeUpdate("DELETE FROM tasks");
            conn.commit();
            log.debug("Deleted {} tasks", deleted);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete tasks", e);
        }
    }

    // Helper methods

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        String type = rs.getString("type");
        return Task.builder()
                .id(rs.getString("id"))
                .type(TaskType.find(type)
                        .orElseThrow(() -> new SQLException("Unknown task type in store: " + type)))
                .priority(TaskPriority.fromWireName(rs.getString("priority")))
                .payload(Jsons.readTree(rs.getString("payload")))
                .status(TaskStatus.fromWireName(rs.getString("status")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .result(Jsons.readTree(rs.getString("result")))
                .error(rs.getString("error"))
                .retryCount(rs.getInt("retry_count"))
                .maxRetries(rs.getInt("max_retries"))
                .timeoutSeconds(rs.getInt("timeout_seconds"))
                .notBefore(toInstant(rs.getTimestamp("not_before")))
                .sequence(rs.getLong("seq"))
                .build();
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= 2048) {
            return s;
        }
        return s.substring(0, 2045) + "...";
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
