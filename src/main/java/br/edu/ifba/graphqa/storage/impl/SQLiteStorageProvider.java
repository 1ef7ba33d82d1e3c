package br.edu.ifba.graphqa.storage.impl;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import br.edu.ifba.graphqa.storage.EdgeWeightConfig;
import br.edu.ifba.graphqa.storage.GraphStorage;
import br.edu.ifba.graphqa.storage.GraphStoreUnavailableException;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

/**
 * CDI producer for the SQLite graph store.
 *
 * <p>This provider is activated when {@code kgqa.storage.backend=sqlite}
 * is set in the application configuration. It opens the database, runs schema
 * migrations on startup and produces the {@link GraphStorage} bean.</p>
 *
 * <p>Example configuration:</p>
 * <pre>
 * kgqa.storage.backend=sqlite
 * kgqa.storage.sqlite.path=data/graph.db
 * </pre>
 */
@ApplicationScoped
@IfBuildProperty(name = "kgqa.storage.backend", stringValue = "sqlite")
public class SQLiteStorageProvider {

    private static final Logger LOG = Logger.getLogger(SQLiteStorageProvider.class);

    @ConfigProperty(name = "kgqa.storage.sqlite.path", defaultValue = "data/graph.db")
    String databasePath;

    @ConfigProperty(name = "kgqa.storage.sqlite.read-pool-size", defaultValue = "4")
    int readPoolSize;

    @ConfigProperty(name = "kgqa.storage.sqlite.busy-timeout", defaultValue = "30000")
    long busyTimeoutMs;

    @ConfigProperty(name = "kgqa.storage.sqlite.wal-mode", defaultValue = "true")
    boolean walMode;

    @Inject
    EdgeWeightConfig weightConfig;

    private SQLiteConnectionManager connectionManager;
    private SQLiteGraphStorage graphStorage;

    @PostConstruct
    void initialize() {
        LOG.infof("Initializing SQLite graph store with database: %s", databasePath);
        connectionManager = new SQLiteConnectionManager(
            databasePath, Duration.ofMillis(busyTimeoutMs), walMode, readPoolSize);

        Connection conn = connectionManager.getWriteConnection();
        try {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        } catch (SQLException e) {
            throw new GraphStoreUnavailableException("Failed to run graph schema migrations", e);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
        LOG.info("SQLite graph store initialized successfully");
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down SQLite graph store");
        if (graphStorage != null) {
            graphStorage.close();
        } else if (connectionManager != null) {
            connectionManager.close();
        }
    }

    @Produces
    @ApplicationScoped
    @IfBuildProperty(name = "kgqa.storage.backend", stringValue = "sqlite")
    public GraphStorage produceGraphStorage() {
        if (graphStorage == null) {
            graphStorage = new SQLiteGraphStorage(connectionManager, weightConfig.toBounds());
            graphStorage.initialize().join();
        }
        return graphStorage;
    }
}
