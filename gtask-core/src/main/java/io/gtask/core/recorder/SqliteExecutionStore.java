package io.gtask.core.recorder;

import io.gtask.core.execution.ExecutionRecord;
import io.gtask.core.execution.ExecutionStatus;
import io.gtask.core.query.CommandSummary;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class SqliteExecutionStore implements ExecutionStore {
    // Fixed width so that text order is chronological order.
    private static final DateTimeFormatter STORED_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);
    private static final String COLUMNS = "id, task_uid, command, timestamp, status, output, exit_code, duration_ms";

    private final SqliteDatabase database;

    public SqliteExecutionStore(SqliteDatabase database) {
        this.database = Objects.requireNonNull(database, "database must not be null");
    }

    @Override
    public ExecutionRecord append(ExecutionRecord record) throws IOException {
        String sql = """
            INSERT INTO tasks (task_uid, command, timestamp, status, output, exit_code, duration_ms)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, record.uid());
            statement.setString(2, record.command());
            statement.setString(3, STORED_TIMESTAMP.format(record.timestamp()));
            statement.setString(4, record.status().label());
            statement.setString(5, record.output());
            statement.setInt(6, record.exitCode());
            statement.setLong(7, record.durationMs());
            statement.executeUpdate();
            return record.withSequenceId(SqliteDatabase.lastInsertId(connection));
        } catch (SQLException e) {
            throw new IOException("Failed to insert execution " + record.uid(), e);
        }
    }

    @Override
    public Optional<ExecutionRecord> findByUid(String uid) throws IOException {
        String sql = "SELECT " + COLUMNS + " FROM tasks WHERE task_uid = ?";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, uid);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(toRecord(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to look up execution " + uid, e);
        }
    }

    @Override
    public List<CommandSummary> summarize() throws IOException {
        String sql = """
            SELECT t.command, t.task_uid, t.timestamp, t.output, agg.success_count, agg.failure_count
            FROM (
                SELECT command,
                       MAX(id) AS last_id,
                       SUM(CASE WHEN status = 'Success' THEN 1 ELSE 0 END) AS success_count,
                       SUM(CASE WHEN status = 'Failure' THEN 1 ELSE 0 END) AS failure_count
                FROM tasks
                GROUP BY command
            ) agg
            JOIN tasks t ON t.id = agg.last_id
            ORDER BY t.timestamp DESC, t.id DESC
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<CommandSummary> summaries = new ArrayList<>();
            while (resultSet.next()) {
                summaries.add(new CommandSummary(
                    resultSet.getString("command"),
                    resultSet.getString("task_uid"),
                    Instant.parse(resultSet.getString("timestamp")),
                    resultSet.getInt("success_count"),
                    resultSet.getInt("failure_count"),
                    resultSet.getString("output")
                ));
            }
            return summaries;
        } catch (SQLException e) {
            throw new IOException("Failed to summarize executions", e);
        }
    }

    @Override
    public List<ExecutionRecord> recent(int limit) throws IOException {
        String sql = "SELECT " + COLUMNS + " FROM tasks ORDER BY id DESC LIMIT ?";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, Math.max(1, limit));
            try (ResultSet resultSet = statement.executeQuery()) {
                List<ExecutionRecord> records = new ArrayList<>();
                while (resultSet.next()) {
                    records.add(toRecord(resultSet));
                }
                return records;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list recent executions", e);
        }
    }

    private ExecutionRecord toRecord(ResultSet resultSet) throws SQLException {
        return new ExecutionRecord(
            resultSet.getString("task_uid"),
            resultSet.getLong("id"),
            resultSet.getString("command"),
            Instant.parse(resultSet.getString("timestamp")),
            ExecutionStatus.fromLabel(resultSet.getString("status")),
            resultSet.getString("output"),
            resultSet.getInt("exit_code"),
            resultSet.getLong("duration_ms")
        );
    }
}
