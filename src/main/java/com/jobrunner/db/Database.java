package com.jobrunner.db;

import org.h2.jdbcx.JdbcConnectionPool;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * H2 database holding job models, results, log entries, schedules, hooks and uploaded files.
 *
 * <p>Connections come from H2's {@link JdbcConnectionPool}; callers close them with
 * try-with-resources, which hands them back to the pool. The schema is created from
 * {@code schema.sql} on the classpath when the database is initialized.</p>
 */
public class Database {
    private static final Logger logger = Logger.getLogger(Database.class.getName());

    private static final String SCHEMA_RESOURCE = "schema.sql";
    private static final int POOL_SIZE = 10;
    private static final int CONNECTION_TIMEOUT_SECONDS = 30;

    private final String url;
    private final String user;
    private final String password;
    private JdbcConnectionPool connectionPool;
    private volatile boolean initialized = false;
    private volatile boolean closed = false;

    public Database(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    public synchronized void initialize() throws SQLException {
        if (initialized) {
            logger.fine("Database already initialized");
            return;
        }

        logger.info("Initializing database connection pool for " + url);
        connectionPool = JdbcConnectionPool.create(url, user, password);
        connectionPool.setMaxConnections(POOL_SIZE);
        connectionPool.setLoginTimeout(CONNECTION_TIMEOUT_SECONDS);

        initializeSchema();

        initialized = true;
        logger.info("Database initialization complete");
    }

    public Connection getConnection() throws SQLException {
        if (!initialized) {
            throw new SQLException("Database not initialized. Call initialize() first.");
        }
        if (closed) {
            throw new SQLException("Database has been closed");
        }
        return connectionPool.getConnection();
    }

    // Statements are separated by ';' at the end of a line; '--' lines are comments
    private void initializeSchema() throws SQLException {
        String schema;
        try (InputStream in = Database.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new SQLException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            schema = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema file", e);
        }

        int executedCount = 0;
        try (Connection conn = connectionPool.getConnection();
             Statement stmt = conn.createStatement()) {

            StringBuilder currentStatement = new StringBuilder();
            for (String line : schema.split("\n")) {
                line = line.trim();
                if (line.startsWith("--") || line.isEmpty()) {
                    continue;
                }

                currentStatement.append(line).append(' ');

                if (line.endsWith(";")) {
                    String sql = currentStatement.toString().trim();
                    sql = sql.substring(0, sql.length() - 1).trim();
                    if (!sql.isEmpty()) {
                        stmt.execute(sql);
                        executedCount++;
                    }
                    currentStatement = new StringBuilder();
                }
            }
        }
        logger.info("Executed " + executedCount + " schema statements");
    }

    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (connectionPool != null) {
            int active = connectionPool.getActiveConnections();
            if (active > 0) {
                logger.log(Level.WARNING, "Closing database with {0} connections still in use", active);
            }
            connectionPool.dispose();
        }
        logger.info("Database shutdown complete");
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isClosed() {
        return closed;
    }
}
