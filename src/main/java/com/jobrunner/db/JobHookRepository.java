package com.jobrunner.db;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.jobrunner.changes.ChangeAction;
import com.jobrunner.hooks.JobButton;
import com.jobrunner.hooks.JobHook;

import java.lang.reflect.Type;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Persistence for {@link JobHook} and {@link JobButton} registrations.
 * Content type lists are stored as JSON arrays.
 */
public class JobHookRepository {
    private static final Type STRING_LIST = new TypeToken<List<String>>() { }.getType();

    private final Database database;
    private final Gson gson = new Gson();

    public JobHookRepository(Database database) {
        this.database = database;
    }

    public void saveHook(JobHook hook) throws SQLException {
        if (hook.getId() == null) {
            hook.setId(UUID.randomUUID().toString());
        }
        String sql = "MERGE INTO job_hooks (id, name, class_path, content_types, type_create, type_update, " +
                     "type_delete, enabled) KEY (id) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, hook.getId());
            stmt.setString(2, hook.getName());
            stmt.setString(3, hook.getClassPath());
            stmt.setString(4, gson.toJson(hook.getContentTypes()));
            stmt.setBoolean(5, hook.isTypeCreate());
            stmt.setBoolean(6, hook.isTypeUpdate());
            stmt.setBoolean(7, hook.isTypeDelete());
            stmt.setBoolean(8, hook.isEnabled());

            stmt.executeUpdate();
        }
    }

    /**
     * Find enabled hooks for an object type whose flag for {@code action} is set.
     */
    public List<JobHook> findMatchingHooks(String objectType, ChangeAction action) throws SQLException {
        String flagColumn = switch (action) {
            case CREATE -> "type_create";
            case UPDATE -> "type_update";
            case DELETE -> "type_delete";
        };
        String sql = "SELECT * FROM job_hooks WHERE enabled = TRUE AND " + flagColumn + " = TRUE ORDER BY name";
        List<JobHook> hooks = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                JobHook hook = mapResultSetToHook(rs);
                // content types are a JSON column, so the type filter runs here
                if (hook.matches(objectType, action)) {
                    hooks.add(hook);
                }
            }
        }

        return hooks;
    }

    public List<JobHook> findAllHooks() throws SQLException {
        String sql = "SELECT * FROM job_hooks ORDER BY name";
        List<JobHook> hooks = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                hooks.add(mapResultSetToHook(rs));
            }
        }

        return hooks;
    }

    public void saveButton(JobButton button) throws SQLException {
        if (button.getId() == null) {
            button.setId(UUID.randomUUID().toString());
        }
        String sql = "MERGE INTO job_buttons (id, name, class_path, content_types, text, weight, group_name, " +
                     "button_class, confirmation) KEY (id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, button.getId());
            stmt.setString(2, button.getName());
            stmt.setString(3, button.getClassPath());
            stmt.setString(4, gson.toJson(button.getContentTypes()));
            stmt.setString(5, button.getText());
            stmt.setInt(6, button.getWeight());
            stmt.setString(7, button.getGroupName());
            stmt.setString(8, button.getButtonClass());
            stmt.setBoolean(9, button.isConfirmation());

            stmt.executeUpdate();
        }
    }

    /**
     * @return the button, or null if not found
     */
    public JobButton findButton(String id) throws SQLException {
        String sql = "SELECT * FROM job_buttons WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, id);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return mapResultSetToButton(rs);
                }
            }
        }

        return null;
    }

    /**
     * Buttons to show on objects of a type, by weight then name.
     */
    public List<JobButton> findButtonsForType(String objectType) throws SQLException {
        String sql = "SELECT * FROM job_buttons ORDER BY weight, name";
        List<JobButton> buttons = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                JobButton button = mapResultSetToButton(rs);
                if (button.getContentTypes().contains(objectType)) {
                    buttons.add(button);
                }
            }
        }

        return buttons;
    }

    private JobHook mapResultSetToHook(ResultSet rs) throws SQLException {
        JobHook hook = new JobHook();
        hook.setId(rs.getString("id"));
        hook.setName(rs.getString("name"));
        hook.setClassPath(rs.getString("class_path"));
        hook.setContentTypes(readList(rs.getString("content_types")));
        hook.setTypeCreate(rs.getBoolean("type_create"));
        hook.setTypeUpdate(rs.getBoolean("type_update"));
        hook.setTypeDelete(rs.getBoolean("type_delete"));
        hook.setEnabled(rs.getBoolean("enabled"));
        return hook;
    }

    private JobButton mapResultSetToButton(ResultSet rs) throws SQLException {
        JobButton button = new JobButton();
        button.setId(rs.getString("id"));
        button.setName(rs.getString("name"));
        button.setClassPath(rs.getString("class_path"));
        button.setContentTypes(readList(rs.getString("content_types")));
        button.setText(rs.getString("text"));
        button.setWeight(rs.getInt("weight"));
        button.setGroupName(rs.getString("group_name"));
        button.setButtonClass(rs.getString("button_class"));
        button.setConfirmation(rs.getBoolean("confirmation"));
        return button;
    }

    private List<String> readList(String json) {
        List<String> values = gson.fromJson(json, STRING_LIST);
        return values == null ? List.of() : values;
    }
}
