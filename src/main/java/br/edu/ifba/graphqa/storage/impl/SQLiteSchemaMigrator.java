package br.edu.ifba.graphqa.storage.impl;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

/**
 * Applies the graph schema migrations on startup.
 *
 * <p>Migrations are SQL files on the classpath under {@code /db/migrations/},
 * named {@code V{version}__{description}.sql}, and are applied in version order
 * inside a single transaction. Applied versions are recorded in
 * {@code schema_version}.</p>
 */
public final class SQLiteSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(SQLiteSchemaMigrator.class);

    private static final String MIGRATION_PATH = "/db/migrations/";

    private final List<Migration> migrations;

    public SQLiteSchemaMigrator() {
        this.migrations = List.of(
            new Migration(1, "Graph entities, relations and centrality scores",
                MIGRATION_PATH + "V001__graph_schema.sql"));
    }

    /**
     * Gets current schema version from database.
     *
     * @param conn database connection
     * @return current version number, 0 if not initialized
     */
    public int getCurrentVersion(Connection conn) {
        try {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(
                     "SELECT name FROM sqlite_master WHERE type='table' AND name='schema_version'")) {
                if (!rs.next()) {
                    return 0;
                }
            }
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
                if (rs.next()) {
                    int version = rs.getInt(1);
                    if (!rs.wasNull()) {
                        return version;
                    }
                }
            }
            return 0;
        } catch (SQLException e) {
            LOG.debug("Error getting current schema version", e);
            return 0;
        }
    }

    /**
     * Applies all pending migrations.
     *
     * @param conn database connection
     * @throws SQLException if migration fails
     */
    public void migrateToLatest(Connection conn) throws SQLException {
        int currentVersion = getCurrentVersion(conn);
        LOG.infof("Current graph schema version: %d", currentVersion);

        boolean autoCommit = conn.getAutoCommit();
        try {
            conn.setAutoCommit(false);
            for (Migration migration : migrations) {
                if (migration.version() > currentVersion) {
                    LOG.infof("Applying migration V%03d: %s", migration.version(), migration.description());
                    migration.apply(conn);
                }
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    public int getLatestVersion() {
        return migrations.get(migrations.size() - 1).version();
    }

    /**
     * A migration loaded from a classpath SQL script.
     */
    record Migration(int version, String description, String resourcePath) {

        void apply(Connection conn) throws SQLException {
            try (Statement stmt = conn.createStatement()) {
                for (String statement : splitStatements(loadResource())) {
                    LOG.tracef("Executing: %s", statement.substring(0, Math.min(50, statement.length())));
                    stmt.execute(statement);
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(
                    "INSERT INTO schema_version (version, description) VALUES (?, ?)")) {
                stmt.setInt(1, version);
                stmt.setString(2, description);
                stmt.executeUpdate();
            }
        }

        private String loadResource() {
            InputStream is = SQLiteSchemaMigrator.class.getResourceAsStream(resourcePath);
            if (is == null) {
                throw new IllegalStateException("Migration resource not found: " + resourcePath);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            } catch (Exception e) {
                throw new IllegalStateException("Failed to load migration: " + resourcePath, e);
            }
        }

        // Scripts hold plain DDL: no semicolons inside literals, comments only on their own lines.
        static List<String> splitStatements(String sql) {
            StringBuilder cleaned = new StringBuilder();
            for (String line : sql.split("\n")) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith("--")) {
                    cleaned.append(line).append('\n');
                }
            }
            List<String> statements = new ArrayList<>();
            for (String part : cleaned.toString().split(";")) {
                String statement = part.trim();
                if (!statement.isEmpty()) {
                    statements.add(statement);
                }
            }
            return statements;
        }
    }
}
