package io.gtask.core.job;

import io.gtask.core.error.DuplicateJobException;
import io.gtask.core.recorder.SqliteDatabase;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class SqliteJobStore implements JobStore {
    private final SqliteDatabase database;

    public SqliteJobStore(SqliteDatabase database) {
        this.database = Objects.requireNonNull(database, "database must not be null");
    }

    @Override
    public List<JobDefinition> loadAll() throws IOException {
        String sql = """
            SELECT id, name, schedule, command, description, active, timeout_seconds, created_at, updated_at
            FROM jobs
            ORDER BY id ASC
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<JobDefinition> jobs = new ArrayList<>();
            while (resultSet.next()) {
                jobs.add(new JobDefinition(
                    resultSet.getLong("id"),
                    resultSet.getString("name"),
                    resultSet.getString("schedule"),
                    resultSet.getString("command"),
                    resultSet.getString("description"),
                    resultSet.getInt("active") != 0,
                    resultSet.getLong("timeout_seconds"),
                    Instant.parse(resultSet.getString("created_at")),
                    Instant.parse(resultSet.getString("updated_at"))
                ));
            }
            return jobs;
        } catch (SQLException e) {
            throw new IOException("Failed to load jobs", e);
        }
    }

    @Override
    public JobDefinition insert(NewJob job, Instant createdAt) throws IOException {
        String sql = """
            INSERT INTO jobs (name, schedule, command, description, active, timeout_seconds, created_at, updated_at)
            VALUES (?, ?, ?, ?, 1, ?, ?, ?)
            """;
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, job.name());
            statement.setString(2, job.schedule());
            statement.setString(3, job.command());
            statement.setString(4, job.description() == null ? "" : job.description());
            statement.setLong(5, job.timeoutSeconds());
            statement.setString(6, createdAt.toString());
            statement.setString(7, createdAt.toString());
            statement.executeUpdate();
            return new JobDefinition(
                SqliteDatabase.lastInsertId(connection),
                job.name(),
                job.schedule(),
                job.command(),
                job.description(),
                true,
                job.timeoutSeconds(),
                createdAt,
                createdAt
            );
        } catch (SQLException e) {
            if (String.valueOf(e.getMessage()).contains("UNIQUE constraint failed: jobs.name")) {
                throw new DuplicateJobException(job.name());
            }
            throw new IOException("Failed to insert job " + job.name(), e);
        }
    }

    @Override
    public void updateActive(long id, boolean active, Instant updatedAt) throws IOException {
        String sql = "UPDATE jobs SET active = ?, updated_at = ? WHERE id = ?";
        try (Connection connection = database.openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, active ? 1 : 0);
            statement.setString(2, updatedAt.toString());
            statement.setLong(3, id);
            if (statement.executeUpdate() == 0) {
                throw new IOException("No job row with id " + id);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to update job " + id, e);
        }
    }
}
