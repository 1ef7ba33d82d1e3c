package br.edu.ifba.graphqa.centrality;

import br.edu.ifba.graphqa.core.Entity;
import br.edu.ifba.graphqa.core.QueryValidationException;
import br.edu.ifba.graphqa.storage.GraphSnapshot;
import br.edu.ifba.graphqa.storage.GraphStorage;
import br.edu.ifba.graphqa.storage.TypeFilter;
import br.edu.ifba.graphqa.utils.Futures;
import br.edu.ifba.graphqa.utils.TransientSQLExceptionPredicate;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import io.smallrye.faulttolerance.api.RetryWhen;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.Nullable;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recomputes and serves entity centrality scores.
 *
 * <p>A recomputation loads a snapshot of the (optionally type-filtered) graph,
 * runs PageRank on it and replaces every stored score of that subset in one
 * atomic store operation. Runs are serialized; queries keep reading the previous
 * scores until the replacement commits.</p>
 */
@ApplicationScoped
public class CentralityService {

    private static final Logger LOG = Logger.getLogger(CentralityService.class);

    private static final double CONVERGED_CONFIDENCE = 0.95;
    private static final double DEGRADED_CONFIDENCE = 0.8;

    private final GraphStorage graphStorage;
    private final CentralityCalculator calculator;

    @Inject
    public CentralityService(GraphStorage graphStorage, CentralityConfig config) {
        this(graphStorage, new CentralityCalculator(config.toOptions()));
    }

    public CentralityService(GraphStorage graphStorage, CentralityCalculator calculator) {
        this.graphStorage = graphStorage;
        this.calculator = calculator;
    }

    /**
     * Recomputes centrality for all entities, or only those of one type.
     *
     * @param entityType type tag to restrict the computation to, or null for the whole graph
     * @param topK number of entities to report, or null for the configured default
     * @return the report with the top entities
     * @throws GraphEmptyException if the (filtered) graph has no nodes
     * @throws QueryValidationException if the type tag is malformed
     */
    @Retry(maxRetries = 3, delay = 200, delayUnit = ChronoUnit.MILLIS, maxDuration = 30, durationUnit = ChronoUnit.SECONDS)
    @ExponentialBackoff(maxDelay = 5, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientSQLExceptionPredicate.class)
    public synchronized CentralityReport recompute(@Nullable String entityType, @Nullable Integer topK) {
        long start = System.nanoTime();
        TypeFilter filter = toFilter(entityType);
        int reportSize = topK == null || topK < 1 ? calculator.getOptions().topK() : topK;

        GraphSnapshot snapshot = Futures.await(graphStorage.loadSnapshot(filter));
        LOG.infof("Computing centrality for %s: %d nodes, %d relations",
            filter, snapshot.nodeIds().size(), snapshot.relations().size());

        CentralityResult result = calculator.calculate(snapshot);
        List<Map.Entry<String, Double>> ranked = result.ranked(calculator.getOptions().minScore());

        Map<String, Double> toStore = new LinkedHashMap<>();
        ranked.forEach(e -> toStore.put(e.getKey(), e.getValue()));
        Futures.await(graphStorage.replaceScores(filter, toStore));

        List<CentralityReport.RankedEntity> top = new ArrayList<>();
        int total = ranked.size();
        for (int i = 0; i < Math.min(reportSize, total); i++) {
            Map.Entry<String, Double> entry = ranked.get(i);
            Entity entity = Futures.await(graphStorage.getEntity(entry.getKey()));
            double percentile = Math.round((total - i) * 1000.0 / total) / 10.0;
            top.add(new CentralityReport.RankedEntity(
                entry.getKey(),
                entity != null ? entity.getCanonicalName() : entry.getKey(),
                entity != null ? entity.getEntityType() : "UNKNOWN",
                entry.getValue(),
                i + 1,
                percentile));
        }

        double elapsed = (System.nanoTime() - start) / 1_000_000_000.0;
        if (!result.converged()) {
            LOG.warnf("Centrality for %s did not converge after %d iterations; stored approximate scores",
                filter, result.iterations());
        }
        LOG.infof("Centrality for %s stored %d scores in %.3fs", filter, toStore.size(), elapsed);

        return new CentralityReport(
            entityType,
            result.metrics().nodeCount(),
            toStore.size(),
            top,
            result.metrics(),
            result.converged(),
            result.iterations(),
            result.converged() ? CONVERGED_CONFIDENCE : DEGRADED_CONFIDENCE,
            elapsed);
    }

    /**
     * Entities with the highest stored scores.
     */
    public List<Entity> topEntities(int limit, @Nullable String entityType) {
        return Futures.await(graphStorage.topByCentrality(Math.max(1, limit), toFilter(entityType)));
    }

    private static TypeFilter toFilter(@Nullable String entityType) {
        if (entityType == null || entityType.isBlank()) {
            return TypeFilter.none();
        }
        try {
            return TypeFilter.of(entityType);
        } catch (IllegalArgumentException e) {
            throw new QueryValidationException(e.getMessage());
        }
    }
}
