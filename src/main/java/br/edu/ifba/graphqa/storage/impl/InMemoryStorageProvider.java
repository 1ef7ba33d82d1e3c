package br.edu.ifba.graphqa.storage.impl;

import org.jboss.logging.Logger;

import br.edu.ifba.graphqa.storage.EdgeWeightConfig;
import br.edu.ifba.graphqa.storage.GraphStorage;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

/**
 * CDI producer for the in-memory graph store, the default backend
 * ({@code kgqa.storage.backend=memory}). Data is lost on shutdown.
 */
@ApplicationScoped
@IfBuildProperty(name = "kgqa.storage.backend", stringValue = "memory", enableIfMissing = true)
public class InMemoryStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryStorageProvider.class);

    @Inject
    EdgeWeightConfig weightConfig;

    @Produces
    @ApplicationScoped
    @IfBuildProperty(name = "kgqa.storage.backend", stringValue = "memory", enableIfMissing = true)
    public GraphStorage produceGraphStorage() {
        InMemoryGraphStorage storage = new InMemoryGraphStorage(weightConfig.toBounds());
        storage.initialize().join();
        LOG.info("Using in-memory graph store");
        return storage;
    }

    void closeGraphStorage(@Disposes GraphStorage storage) throws Exception {
        storage.close();
    }
}
