package br.edu.ifba.graphqa.storage.impl;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;
import org.sqlite.SQLiteConfig;

import br.edu.ifba.graphqa.storage.GraphStoreUnavailableException;

/**
 * Manages SQLite connections and pragma configuration for the graph database.
 * Thread-safe with connection pooling for read operations.
 *
 * <p>Features:</p>
 * <ul>
 *   <li>WAL mode, so queries keep reading the last committed score generation while
 *       a centrality run rewrites scores</li>
 *   <li>Connection pool for read operations</li>
 *   <li>Exclusive write connection guarded by a ReentrantLock</li>
 *   <li>Configurable busy timeout for lock waiting</li>
 *   <li>Foreign key enforcement enabled</li>
 * </ul>
 *
 * <p>Usage:</p>
 * <pre>
 * SQLiteConnectionManager manager = new SQLiteConnectionManager("data/graph.db");
 * try (Connection conn = manager.createConnection()) {
 *     // Use connection
 * }
 * </pre>
 */
public final class SQLiteConnectionManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SQLiteConnectionManager.class);

    private static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(30);
    private static final boolean DEFAULT_WAL_MODE = true;
    private static final int DEFAULT_POOL_SIZE = 4;
    private static final int DEFAULT_CACHE_SIZE = -2000; // 2MB

    private final String databasePath;
    private final Duration busyTimeout;
    private final boolean walMode;
    private final BlockingQueue<Connection> readPool;
    private final ReentrantLock writeLock;

    private Connection writeConnection;
    private volatile boolean closed = false;

    /**
     * Creates a connection manager with default settings.
     *
     * @param databasePath path to SQLite database file
     */
    public SQLiteConnectionManager(String databasePath) {
        this(databasePath, DEFAULT_BUSY_TIMEOUT, DEFAULT_WAL_MODE, DEFAULT_POOL_SIZE);
    }

    /**
     * Creates a connection manager with custom settings.
     *
     * @param databasePath path to SQLite database file
     * @param busyTimeout how long to wait for locks
     * @param walMode whether to enable WAL mode
     * @param readPoolSize number of connections in read pool
     */
    public SQLiteConnectionManager(String databasePath, Duration busyTimeout,
            boolean walMode, int readPoolSize) {
        if (databasePath == null || databasePath.isBlank() || databasePath.startsWith(":memory:")) {
            throw new IllegalArgumentException(
                "A database file path is required; pooled connections cannot share a ':memory:' database");
        }
        this.databasePath = databasePath;
        this.busyTimeout = busyTimeout;
        this.walMode = walMode;
        this.readPool = new ArrayBlockingQueue<>(readPoolSize);
        this.writeLock = new ReentrantLock();
    }

    /**
     * Creates a new connection with pragmas configured.
     *
     * @return configured Connection
     * @throws GraphStoreUnavailableException if the database cannot be opened
     */
    public Connection createConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }

        try {
            Path dbPath = Paths.get(databasePath);
            Path parentDir = dbPath.getParent();
            if (parentDir != null && !Files.exists(parentDir)) {
                Files.createDirectories(parentDir);
                LOG.infof("Created database directory: %s", parentDir);
            }
        } catch (Exception e) {
            LOG.warnf("Could not create parent directory for %s: %s", databasePath, e.getMessage());
        }

        try {
            SQLiteConfig config = new SQLiteConfig();
            config.enforceForeignKeys(true);
            config.setBusyTimeout((int) busyTimeout.toMillis());
            config.setCacheSize(DEFAULT_CACHE_SIZE);

            String url = "jdbc:sqlite:" + databasePath;
            Connection conn = DriverManager.getConnection(url, config.toProperties());

            applyPragmas(conn);

            LOG.debugf("Created SQLite connection to %s", databasePath);
            return conn;
        } catch (SQLException e) {
            throw new GraphStoreUnavailableException("Failed to open graph database " + databasePath, e);
        }
    }

    /**
     * Gets a connection for read operations from the pool.
     * Creates a new connection if pool is empty.
     *
     * @return pooled read Connection
     */
    public Connection getReadConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }

        Connection conn = readPool.poll();
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    return conn;
                }
            } catch (SQLException e) {
                LOG.debug("Read connection was closed, creating new one", e);
            }
        }

        return createConnection();
    }

    /**
     * Returns a read connection to the pool.
     *
     * @param conn the connection to release
     */
    public void releaseReadConnection(Connection conn) {
        if (conn == null) {
            return;
        }

        try {
            if (!conn.isClosed() && !closed) {
                if (!readPool.offer(conn)) {
                    conn.close();
                }
            } else {
                conn.close();
            }
        } catch (SQLException e) {
            LOG.debug("Error releasing read connection", e);
        }
    }

    /**
     * Gets exclusive connection for write operations.
     * Only one write connection can be active at a time.
     *
     * @return write Connection with lock held
     */
    public Connection getWriteConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }

        writeLock.lock();
        try {
            if (writeConnection == null || writeConnection.isClosed()) {
                writeConnection = createConnection();
            }
            return writeConnection;
        } catch (SQLException | RuntimeException e) {
            writeLock.unlock();
            throw new GraphStoreUnavailableException("Failed to get write connection", e);
        }
    }

    /**
     * Releases the write connection lock.
     *
     * @param conn the write connection (must match current write connection)
     */
    public void releaseWriteConnection(Connection conn) {
        if (conn == writeConnection) {
            writeLock.unlock();
        }
    }

    private void applyPragmas(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            if (walMode) {
                stmt.execute("PRAGMA journal_mode = WAL");
            }
            stmt.execute("PRAGMA synchronous = NORMAL");
            stmt.execute("PRAGMA temp_store = MEMORY");
        }
    }

    public String getDatabasePath() {
        return databasePath;
    }

    public boolean isWalModeEnabled() {
        return walMode;
    }

    /**
     * Closes the connection manager and all connections.
     */
    @Override
    public void close() {
        closed = true;

        if (writeConnection != null) {
            try {
                writeConnection.close();
            } catch (SQLException e) {
                LOG.debug("Error closing write connection", e);
            }
            writeConnection = null;
        }

        Connection conn;
        while ((conn = readPool.poll()) != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                LOG.debug("Error closing pooled connection", e);
            }
        }

        LOG.infof("Closed SQLite connection manager for %s", databasePath);
    }
}
