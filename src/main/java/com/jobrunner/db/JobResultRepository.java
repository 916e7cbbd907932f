package com.jobrunner.db;

import com.jobrunner.core.JobLogEntry;
import com.jobrunner.core.JobResult;
import com.jobrunner.core.JobStatus;
import com.jobrunner.core.LogLevel;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persistence for {@link JobResult} rows and their {@link JobLogEntry} lines.
 * All methods use PreparedStatement and try-with-resources for safe resource management.
 */
public class JobResultRepository {
    private final Database database;

    public JobResultRepository(Database database) {
        this.database = database;
    }

    /**
     * Insert a new result row.
     *
     * @param result the result; its id is the task id
     * @throws SQLException if database operation fails, including a duplicate task id
     */
    public void createResult(JobResult result) throws SQLException {
        String sql = "INSERT INTO job_results (id, class_path, job_name, status, created_at, user_name, " +
                     "task_kwargs, scheduled_job_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, result.getId());
            stmt.setString(2, result.getClassPath());
            stmt.setString(3, result.getJobName());
            stmt.setString(4, result.getStatus().name());
            stmt.setTimestamp(5, Timestamp.from(result.getCreatedAt()));
            stmt.setString(6, result.getUserName());
            stmt.setString(7, result.getTaskKwargs());
            stmt.setString(8, result.getScheduledJobId());

            stmt.executeUpdate();
        }
    }

    /**
     * Retrieve a result by id.
     *
     * @return the result, or null if not found
     * @throws SQLException if database operation fails
     */
    public JobResult getResult(String id) throws SQLException {
        String sql = "SELECT * FROM job_results WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, id);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return mapResultSetToResult(rs);
                }
            }
        }

        return null;
    }

    /**
     * List results for one job, newest first.
     */
    public List<JobResult> getResultsForClassPath(String classPath) throws SQLException {
        String sql = "SELECT * FROM job_results WHERE class_path = ? ORDER BY created_at DESC";
        List<JobResult> results = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, classPath);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    results.add(mapResultSetToResult(rs));
                }
            }
        }

        return results;
    }

    /**
     * Move a pending result to RUNNING.
     *
     * @return true if the row was pending and is now running
     * @throws SQLException if database operation fails
     */
    public boolean markRunning(String id, Instant startedAt) throws SQLException {
        String sql = "UPDATE job_results SET status = ?, started_at = ? WHERE id = ? AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.RUNNING.name());
            stmt.setTimestamp(2, Timestamp.from(startedAt));
            stmt.setString(3, id);
            stmt.setString(4, JobStatus.PENDING.name());

            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Write the terminal status of a result.
     *
     * <p>The update only applies while the row is not yet terminal, so a result is completed
     * at most once even if a timeout report races the worker.</p>
     *
     * @param id the result id
     * @param status a terminal status
     * @param resultJson JSON return value, only stored for SUCCESS
     * @param completedAt completion time
     * @return true if this call wrote the terminal status
     * @throws SQLException if database operation fails
     */
    public boolean completeResult(String id, JobStatus status, String resultJson, Instant completedAt)
            throws SQLException {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status.name());
        }
        String sql = "UPDATE job_results SET status = ?, result_json = ?, completed_at = ? " +
                     "WHERE id = ? AND status NOT IN (?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, status.name());
            stmt.setString(2, status == JobStatus.SUCCESS ? resultJson : null);
            stmt.setTimestamp(3, Timestamp.from(completedAt));
            stmt.setString(4, id);
            stmt.setString(5, JobStatus.SUCCESS.name());
            stmt.setString(6, JobStatus.FAILURE.name());
            stmt.setString(7, JobStatus.ERRORED.name());

            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Append one log entry. Each entry is written in its own statement.
     *
     * @param entry the entry; its generated id is set on return
     * @throws SQLException if database operation fails
     */
    public void appendLogEntry(JobLogEntry entry) throws SQLException {
        String sql = "INSERT INTO job_log_entries (job_result_id, logged_at, log_level, grouping_name, message, " +
                     "object_type, object_id, object_display) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            stmt.setString(1, entry.getJobResultId());
            stmt.setTimestamp(2, Timestamp.from(entry.getLoggedAt()));
            stmt.setString(3, entry.getLevel().getValue());
            stmt.setString(4, entry.getGrouping());
            stmt.setString(5, entry.getMessage());
            stmt.setString(6, entry.getObjectType());
            stmt.setString(7, entry.getObjectId());
            stmt.setString(8, entry.getObjectDisplay());

            stmt.executeUpdate();

            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (keys.next()) {
                    entry.setId(keys.getLong(1));
                }
            }
        }
    }

    /**
     * Get the log of a result in the order it was written.
     */
    public List<JobLogEntry> getLogEntries(String jobResultId) throws SQLException {
        String sql = "SELECT * FROM job_log_entries WHERE job_result_id = ? ORDER BY id ASC";
        List<JobLogEntry> entries = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, jobResultId);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    JobLogEntry entry = new JobLogEntry();
                    entry.setId(rs.getLong("id"));
                    entry.setJobResultId(rs.getString("job_result_id"));
                    entry.setLoggedAt(rs.getTimestamp("logged_at").toInstant());
                    entry.setLevel(LogLevel.fromValue(rs.getString("log_level")));
                    entry.setGrouping(rs.getString("grouping_name"));
                    entry.setMessage(rs.getString("message"));
                    entry.setObjectType(rs.getString("object_type"));
                    entry.setObjectId(rs.getString("object_id"));
                    entry.setObjectDisplay(rs.getString("object_display"));
                    entries.add(entry);
                }
            }
        }

        return entries;
    }

    private JobResult mapResultSetToResult(ResultSet rs) throws SQLException {
        JobResult result = new JobResult();
        result.setId(rs.getString("id"));
        result.setClassPath(rs.getString("class_path"));
        result.setJobName(rs.getString("job_name"));
        result.setStatus(JobStatus.valueOf(rs.getString("status")));
        result.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
        result.setStartedAt(toInstant(rs.getTimestamp("started_at")));
        result.setCompletedAt(toInstant(rs.getTimestamp("completed_at")));
        result.setUserName(rs.getString("user_name"));
        result.setTaskKwargs(rs.getString("task_kwargs"));
        result.setResultJson(rs.getString("result_json"));
        result.setScheduledJobId(rs.getString("scheduled_job_id"));
        return result;
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
