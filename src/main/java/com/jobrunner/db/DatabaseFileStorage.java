package com.jobrunner.db;

import com.jobrunner.core.FileStorage;
import com.jobrunner.core.ObjectNotFoundException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * {@link FileStorage} keeping uploaded files as BLOBs in the {@code file_proxies} table.
 * Handles are UUIDs.
 */
public class DatabaseFileStorage implements FileStorage {
    private static final Logger logger = Logger.getLogger(DatabaseFileStorage.class.getName());

    private final Database database;

    public DatabaseFileStorage(Database database) {
        this.database = database;
    }

    @Override
    public String store(byte[] content, String name) {
        String handle = UUID.randomUUID().toString();
        String sql = "INSERT INTO file_proxies (id, name, content, uploaded_at) VALUES (?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, handle);
            stmt.setString(2, name);
            stmt.setBytes(3, content);
            stmt.setTimestamp(4, Timestamp.from(Instant.now()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to store file " + name, e);
        }

        logger.fine("Stored file " + name + " as " + handle);
        return handle;
    }

    @Override
    public byte[] load(String handle) throws ObjectNotFoundException {
        return (byte[]) read(handle, "content");
    }

    @Override
    public String nameOf(String handle) throws ObjectNotFoundException {
        return (String) read(handle, "name");
    }

    @Override
    public boolean delete(String handle) {
        String sql = "DELETE FROM file_proxies WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, handle);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StorageException("Failed to delete file " + handle, e);
        }
    }

    private Object read(String handle, String column) throws ObjectNotFoundException {
        String sql = "SELECT " + column + " FROM file_proxies WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, handle);

            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new ObjectNotFoundException("File proxy matching query does not exist: " + handle);
                }
                return "content".equals(column) ? rs.getBytes(1) : rs.getString(1);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load file " + handle, e);
        }
    }
}
