package br.edu.ifba.graphqa.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.graphqa.storage.GraphStoreUnavailableException;

/**
 * Unit tests for SQLiteConnectionManager.
 *
 * Tests verify:
 * 1. Connection creation and PRAGMA settings
 * 2. Read pooling and the exclusive write connection
 * 3. Error handling for unusable paths
 */
class SQLiteConnectionManagerTest {

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private Path dbPath;

    @BeforeEach
    void setUp() {
        dbPath = tempDir.resolve("graph.db");
        connectionManager = new SQLiteConnectionManager(dbPath.toString());
    }

    @AfterEach
    void tearDown() {
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    @Test
    void testCreateConnectionCreatesDatabaseFile() throws Exception {
        try (Connection conn = connectionManager.createConnection()) {
            assertNotNull(conn, "Connection should not be null");
            assertFalse(conn.isClosed(), "Connection should be open");
            assertTrue(Files.exists(dbPath), "Database file should be created");
        }
    }

    @Test
    void testCreatesMissingParentDirectories() throws Exception {
        Path nested = tempDir.resolve("data").resolve("graphs").resolve("graph.db");
        SQLiteConnectionManager nestedManager = new SQLiteConnectionManager(nested.toString());
        try (Connection conn = nestedManager.createConnection()) {
            assertTrue(Files.exists(nested), "Nested database file should be created");
        } finally {
            nestedManager.close();
        }
    }

    @Test
    void testRejectsInMemoryDatabase() {
        assertThrows(IllegalArgumentException.class, () -> new SQLiteConnectionManager(":memory:"));
        assertThrows(IllegalArgumentException.class, () -> new SQLiteConnectionManager(" "));
    }

    @Test
    void testWalModeIsEnabled() throws Exception {
        try (Connection conn = connectionManager.createConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA journal_mode")) {
            assertTrue(rs.next(), "Should have result");
            assertEquals("wal", rs.getString(1).toLowerCase(), "Journal mode should be WAL");
        }
        assertTrue(connectionManager.isWalModeEnabled());
    }

    @Test
    void testForeignKeysEnabled() throws Exception {
        try (Connection conn = connectionManager.createConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA foreign_keys")) {
            assertTrue(rs.next(), "Should have result");
            assertEquals(1, rs.getInt(1), "Foreign keys should be enabled");
        }
    }

    @Test
    void testBusyTimeoutConfigured() throws Exception {
        SQLiteConnectionManager customManager = new SQLiteConnectionManager(
            dbPath.toString(),
            Duration.ofSeconds(60),
            true,
            4
        );
        try (Connection conn = customManager.createConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA busy_timeout")) {
            assertTrue(rs.next(), "Should have result");
            assertEquals(60000, rs.getInt(1), "Busy timeout should be 60000ms");
        } finally {
            customManager.close();
        }
    }

    @Test
    void testReadConnectionsAreReused() throws Exception {
        Connection first = connectionManager.getReadConnection();
        connectionManager.releaseReadConnection(first);

        Connection second = connectionManager.getReadConnection();
        try {
            assertSame(first, second, "Released read connection should be pooled");
            assertFalse(second.isClosed(), "Pooled connection should stay open");
        } finally {
            connectionManager.releaseReadConnection(second);
        }
    }

    @Test
    void testWriteConnectionIsShared() throws Exception {
        Connection writeConn = connectionManager.getWriteConnection();
        try (Statement stmt = writeConn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS scratch (id INTEGER)");
            stmt.execute("INSERT INTO scratch VALUES (1)");
        } finally {
            connectionManager.releaseWriteConnection(writeConn);
        }

        Connection again = connectionManager.getWriteConnection();
        try {
            assertSame(writeConn, again, "The single write connection should be reused");
        } finally {
            connectionManager.releaseWriteConnection(again);
        }
    }

    @Test
    void testClosedManagerRefusesConnections() {
        connectionManager.close();

        assertThrows(IllegalStateException.class, connectionManager::getReadConnection);
        assertThrows(IllegalStateException.class, connectionManager::getWriteConnection);
    }

    @Test
    void testUnopenablePathThrowsUnavailable() throws Exception {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        SQLiteConnectionManager invalidManager =
            new SQLiteConnectionManager(blocker.resolve("graph.db").toString());

        assertThrows(GraphStoreUnavailableException.class, invalidManager::createConnection);
        invalidManager.close();
    }
}
