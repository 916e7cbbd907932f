package com.jobrunner.db;

import com.jobrunner.scheduling.JobExecutionType;
import com.jobrunner.scheduling.ScheduledJob;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.jobrunner.db.JobResultRepository.toInstant;
import static com.jobrunner.db.JobResultRepository.toTimestamp;

/**
 * Persistence for {@link ScheduledJob} rows.
 */
public class ScheduledJobRepository {
    private final Database database;

    public ScheduledJobRepository(Database database) {
        this.database = database;
    }

    /**
     * Insert or update a schedule. A schedule without an id gets a new UUID.
     *
     * @throws SQLException if database operation fails
     */
    public void save(ScheduledJob job) throws SQLException {
        if (job.getId() == null) {
            job.setId(UUID.randomUUID().toString());
        }
        String sql = "MERGE INTO scheduled_jobs (id, name, user_name, class_path, task_queue, interval_type, crontab, " +
                     "start_time, next_run, last_run, total_run_count, task_kwargs, approval_required, approved_by, " +
                     "approved_at, enabled) KEY (id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, job.getId());
            stmt.setString(2, job.getName());
            stmt.setString(3, job.getUserName());
            stmt.setString(4, job.getClassPath());
            stmt.setString(5, job.getTaskQueue());
            stmt.setString(6, job.getInterval().name());
            stmt.setString(7, job.getCrontab());
            stmt.setTimestamp(8, toTimestamp(job.getStartTime()));
            stmt.setTimestamp(9, toTimestamp(job.getNextRun()));
            stmt.setTimestamp(10, toTimestamp(job.getLastRun()));
            stmt.setInt(11, job.getTotalRunCount());
            stmt.setString(12, job.getTaskKwargs());
            stmt.setBoolean(13, job.isApprovalRequired());
            stmt.setString(14, job.getApprovedBy());
            stmt.setTimestamp(15, toTimestamp(job.getApprovedAt()));
            stmt.setBoolean(16, job.isEnabled());

            stmt.executeUpdate();
        }
    }

    /**
     * @return the schedule, or null if not found
     */
    public ScheduledJob findById(String id) throws SQLException {
        String sql = "SELECT * FROM scheduled_jobs WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, id);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return mapResultSetToScheduledJob(rs);
                }
            }
        }

        return null;
    }

    /**
     * Find enabled, approved schedules whose next run is at or before {@code now},
     * earliest first.
     */
    public List<ScheduledJob> findDue(Instant now) throws SQLException {
        String sql = "SELECT * FROM scheduled_jobs WHERE enabled = TRUE AND next_run <= ? " +
                     "AND (approval_required = FALSE OR approved_at IS NOT NULL) ORDER BY next_run ASC";
        return query(sql, Timestamp.from(now));
    }

    /**
     * Find schedules waiting for an operator's approval.
     */
    public List<ScheduledJob> findPendingApproval() throws SQLException {
        String sql = "SELECT * FROM scheduled_jobs WHERE approval_required = TRUE AND approved_at IS NULL " +
                     "ORDER BY start_time ASC";
        return query(sql, null);
    }

    public List<ScheduledJob> findAll() throws SQLException {
        return query("SELECT * FROM scheduled_jobs ORDER BY name", null);
    }

    /**
     * @return true if a row was deleted
     */
    public boolean delete(String id) throws SQLException {
        String sql = "DELETE FROM scheduled_jobs WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, id);
            return stmt.executeUpdate() == 1;
        }
    }

    private List<ScheduledJob> query(String sql, Timestamp parameter) throws SQLException {
        List<ScheduledJob> jobs = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            if (parameter != null) {
                stmt.setTimestamp(1, parameter);
            }

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapResultSetToScheduledJob(rs));
                }
            }
        }

        return jobs;
    }

    private ScheduledJob mapResultSetToScheduledJob(ResultSet rs) throws SQLException {
        ScheduledJob job = new ScheduledJob();
        job.setId(rs.getString("id"));
        job.setName(rs.getString("name"));
        job.setUserName(rs.getString("user_name"));
        job.setClassPath(rs.getString("class_path"));
        job.setTaskQueue(rs.getString("task_queue"));
        job.setInterval(JobExecutionType.valueOf(rs.getString("interval_type")));
        job.setCrontab(rs.getString("crontab"));
        job.setStartTime(toInstant(rs.getTimestamp("start_time")));
        job.setNextRun(toInstant(rs.getTimestamp("next_run")));
        job.setLastRun(toInstant(rs.getTimestamp("last_run")));
        job.setTotalRunCount(rs.getInt("total_run_count"));
        job.setTaskKwargs(rs.getString("task_kwargs"));
        job.setApprovalRequired(rs.getBoolean("approval_required"));
        job.setApprovedBy(rs.getString("approved_by"));
        job.setApprovedAt(toInstant(rs.getTimestamp("approved_at")));
        job.setEnabled(rs.getBoolean("enabled"));
        return job;
    }
}
