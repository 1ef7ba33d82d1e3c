package br.edu.ifba.graphqa.storage.impl;

import br.edu.ifba.graphqa.storage.GraphStorage;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;

class SQLiteGraphStorageContractTest extends GraphStorageContractTest {

    @TempDir
    Path tempDir;

    @Override
    protected GraphStorage createStorage() throws Exception {
        SQLiteConnectionManager connectionManager =
            new SQLiteConnectionManager(tempDir.resolve("graph.db").toString());
        Connection conn = connectionManager.getWriteConnection();
        try {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
        SQLiteGraphStorage sqlite = new SQLiteGraphStorage(connectionManager);
        sqlite.initialize().join();
        return sqlite;
    }
}
