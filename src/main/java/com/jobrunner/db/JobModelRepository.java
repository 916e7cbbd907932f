package com.jobrunner.db;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.jobrunner.core.ClassPath;
import com.jobrunner.core.JobKind;
import com.jobrunner.core.JobModel;

import java.lang.reflect.Type;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Persistence for {@link JobModel} rows. Task queue lists are stored as JSON arrays.
 */
public class JobModelRepository {
    private static final Type STRING_LIST = new TypeToken<List<String>>() { }.getType();

    private final Database database;
    private final Gson gson = new Gson();

    public JobModelRepository(Database database) {
        this.database = database;
    }

    /**
     * Insert or update a model. A model without an id gets a new UUID.
     *
     * @throws SQLException if database operation fails
     */
    public void save(JobModel model) throws SQLException {
        if (model.getId() == null) {
            model.setId(UUID.randomUUID().toString());
        }
        String sql = "MERGE INTO job_models (id, source_grouping, module_name, job_class_name, kind, installed, " +
                     "enabled, read_only, name, name_override, grouping_name, grouping_override, description, " +
                     "description_override, hidden, hidden_override, approval_required, approval_required_override, " +
                     "has_sensitive_variables, has_sensitive_variables_override, soft_time_limit_ms, " +
                     "soft_time_limit_override, time_limit_ms, time_limit_override, task_queues, task_queues_override) " +
                     "KEY (id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            int i = 1;
            stmt.setString(i++, model.getId());
            stmt.setString(i++, model.getSourceGrouping());
            stmt.setString(i++, model.getModuleName());
            stmt.setString(i++, model.getJobClassName());
            stmt.setString(i++, model.getKind().name());
            stmt.setBoolean(i++, model.isInstalled());
            stmt.setBoolean(i++, model.isEnabled());
            stmt.setBoolean(i++, model.isReadOnly());
            stmt.setString(i++, model.getName());
            stmt.setBoolean(i++, model.isNameOverride());
            stmt.setString(i++, model.getGrouping());
            stmt.setBoolean(i++, model.isGroupingOverride());
            stmt.setString(i++, model.getDescription());
            stmt.setBoolean(i++, model.isDescriptionOverride());
            stmt.setBoolean(i++, model.isHidden());
            stmt.setBoolean(i++, model.isHiddenOverride());
            stmt.setBoolean(i++, model.isApprovalRequired());
            stmt.setBoolean(i++, model.isApprovalRequiredOverride());
            stmt.setBoolean(i++, model.hasSensitiveVariables());
            stmt.setBoolean(i++, model.isHasSensitiveVariablesOverride());
            stmt.setLong(i++, model.getSoftTimeLimit().toMillis());
            stmt.setBoolean(i++, model.isSoftTimeLimitOverride());
            stmt.setLong(i++, model.getTimeLimit().toMillis());
            stmt.setBoolean(i++, model.isTimeLimitOverride());
            stmt.setString(i++, gson.toJson(model.getTaskQueues()));
            stmt.setBoolean(i, model.isTaskQueuesOverride());

            stmt.executeUpdate();
        }
    }

    /**
     * Retrieve the model for a class path.
     *
     * @return the model, or null if the job was never synchronized
     * @throws SQLException if database operation fails
     */
    public JobModel findByClassPath(ClassPath classPath) throws SQLException {
        String sql = "SELECT * FROM job_models WHERE source_grouping = ? AND module_name = ? AND job_class_name = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, classPath.getSourceGrouping());
            stmt.setString(2, classPath.getModuleName());
            stmt.setString(3, classPath.getClassName());

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return mapResultSetToModel(rs);
                }
            }
        }

        return null;
    }

    public List<JobModel> findAll() throws SQLException {
        String sql = "SELECT * FROM job_models ORDER BY grouping_name, name";
        List<JobModel> models = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                models.add(mapResultSetToModel(rs));
            }
        }

        return models;
    }

    private JobModel mapResultSetToModel(ResultSet rs) throws SQLException {
        JobModel model = new JobModel();
        model.setId(rs.getString("id"));
        model.setSourceGrouping(rs.getString("source_grouping"));
        model.setModuleName(rs.getString("module_name"));
        model.setJobClassName(rs.getString("job_class_name"));
        model.setKind(JobKind.valueOf(rs.getString("kind")));
        model.setInstalled(rs.getBoolean("installed"));
        model.setEnabled(rs.getBoolean("enabled"));
        model.setReadOnly(rs.getBoolean("read_only"));
        model.setName(rs.getString("name"));
        model.setNameOverride(rs.getBoolean("name_override"));
        model.setGrouping(rs.getString("grouping_name"));
        model.setGroupingOverride(rs.getBoolean("grouping_override"));
        model.setDescription(rs.getString("description"));
        model.setDescriptionOverride(rs.getBoolean("description_override"));
        model.setHidden(rs.getBoolean("hidden"));
        model.setHiddenOverride(rs.getBoolean("hidden_override"));
        model.setApprovalRequired(rs.getBoolean("approval_required"));
        model.setApprovalRequiredOverride(rs.getBoolean("approval_required_override"));
        model.setHasSensitiveVariables(rs.getBoolean("has_sensitive_variables"));
        model.setHasSensitiveVariablesOverride(rs.getBoolean("has_sensitive_variables_override"));
        model.setSoftTimeLimit(Duration.ofMillis(rs.getLong("soft_time_limit_ms")));
        model.setSoftTimeLimitOverride(rs.getBoolean("soft_time_limit_override"));
        model.setTimeLimit(Duration.ofMillis(rs.getLong("time_limit_ms")));
        model.setTimeLimitOverride(rs.getBoolean("time_limit_override"));
        List<String> queues = gson.fromJson(rs.getString("task_queues"), STRING_LIST);
        model.setTaskQueues(queues == null ? List.of() : queues);
        model.setTaskQueuesOverride(rs.getBoolean("task_queues_override"));
        return model;
    }
}
