package br.edu.ifba.graphqa.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SQLiteSchemaMigratorTest {

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private final SQLiteSchemaMigrator migrator = new SQLiteSchemaMigrator();

    @BeforeEach
    void setUp() {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("graph.db").toString());
    }

    @AfterEach
    void tearDown() {
        connectionManager.close();
    }

    @Test
    void testFreshDatabaseHasVersionZero() {
        Connection conn = connectionManager.getWriteConnection();
        try {
            assertEquals(0, migrator.getCurrentVersion(conn));
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
    }

    @Test
    void testMigrateCreatesGraphTables() throws Exception {
        Connection conn = connectionManager.getWriteConnection();
        try {
            migrator.migrateToLatest(conn);

            assertEquals(migrator.getLatestVersion(), migrator.getCurrentVersion(conn));
            for (String table : List.of("graph_entities", "graph_relations", "centrality_scores")) {
                try (Statement stmt = conn.createStatement();
                     ResultSet rs = stmt.executeQuery(
                         "SELECT name FROM sqlite_master WHERE type='table' AND name='" + table + "'")) {
                    assertTrue(rs.next(), "Table " + table + " should exist");
                }
            }
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
    }

    @Test
    void testMigrateIsIdempotent() throws Exception {
        Connection conn = connectionManager.getWriteConnection();
        try {
            migrator.migrateToLatest(conn);
            migrator.migrateToLatest(conn);

            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM schema_version")) {
                assertTrue(rs.next());
                assertEquals(1, rs.getInt(1), "Each migration should be recorded once");
            }
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
    }

    @Test
    void testSplitStatementsSkipsComments() {
        List<String> statements = SQLiteSchemaMigrator.Migration.splitStatements(
            "-- header\nCREATE TABLE a (id INTEGER);\n\n-- another\nCREATE INDEX i ON a(id);\n");

        assertEquals(List.of("CREATE TABLE a (id INTEGER)", "CREATE INDEX i ON a(id)"), statements);
    }
}
