package br.edu.ifba.graphqa.storage.impl;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.graphqa.storage.GraphStorage;

import java.util.Locale;
import java.util.Set;

/**
 * Validates the graph store configuration on application startup.
 *
 * <p>Supported backends:</p>
 * <ul>
 *   <li><code>memory</code> - in-memory adjacency maps (default)</li>
 *   <li><code>sqlite</code> - SQLite database file</li>
 * </ul>
 *
 * <p>Resolving the store here also opens it, so an unreachable database stops
 * startup instead of failing the first query.</p>
 */
@ApplicationScoped
public class StorageBackendValidator {

    private static final Logger logger = LoggerFactory.getLogger(StorageBackendValidator.class);

    private static final Set<String> SUPPORTED_BACKENDS = Set.of("memory", "sqlite");

    @ConfigProperty(name = "kgqa.storage.backend", defaultValue = "memory")
    String configuredBackend;

    @Inject
    Instance<GraphStorage> graphStorageInstances;

    void onStart(@Observes StartupEvent event) {
        logger.info("Validating graph store configuration...");

        String backend = configuredBackend == null ? "" : configuredBackend.trim().toLowerCase(Locale.ROOT);
        if (!SUPPORTED_BACKENDS.contains(backend)) {
            throw new IllegalStateException(
                "Invalid graph store backend: '" + configuredBackend + "'. Supported backends: 'memory', 'sqlite'");
        }
        if (graphStorageInstances.isUnsatisfied()) {
            throw new IllegalStateException("No GraphStorage implementation found for backend '" + backend + "'");
        }
        if (graphStorageInstances.isAmbiguous()) {
            throw new IllegalStateException(
                "Multiple GraphStorage implementations found. Ensure only one backend is configured via "
                    + "'kgqa.storage.backend'");
        }

        GraphStorage.GraphStats stats = graphStorageInstances.get().getStats().join();
        logger.info("Graph store validation complete: {} backend active ({} entities, {} relations)",
            backend, stats.entityCount(), stats.relationCount());
    }
}
