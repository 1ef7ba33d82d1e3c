package br.edu.ifba.graphqa.query;

import br.edu.ifba.graphqa.core.MultiHopQuery;
import br.edu.ifba.graphqa.resolve.TaxonomyConfig;
import br.edu.ifba.graphqa.storage.GraphStorage;
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

/**
 * Application entry point for multi-hop questions.
 */
@ApplicationScoped
public class MultiHopQueryService {

    private static final Logger LOG = Logger.getLogger(MultiHopQueryService.class);

    private final MultiHopQueryEngine engine;

    @Inject
    public MultiHopQueryService(GraphStorage graphStorage, QueryConfig queryConfig, TaxonomyConfig taxonomyConfig) {
        this(new MultiHopQueryEngine(graphStorage, queryConfig.toOptions(), taxonomyConfig.toTaxonomy()));
    }

    public MultiHopQueryService(MultiHopQueryEngine engine) {
        this.engine = engine;
    }

    /**
     * Answers a question. Out-of-range hop counts and limits are clamped.
     *
     * @throws br.edu.ifba.graphqa.core.QueryValidationException if the query text is blank
     * @throws br.edu.ifba.graphqa.storage.GraphStoreUnavailableException if the store cannot be reached
     */
    @Retry(maxRetries = 3, delay = 200, delayUnit = ChronoUnit.MILLIS, maxDuration = 30, durationUnit = ChronoUnit.SECONDS)
    @ExponentialBackoff(maxDelay = 5, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientSQLExceptionPredicate.class)
    public MultiHopQueryResult query(@Nullable String queryText, @Nullable Integer maxHops,
                                     @Nullable Integer resultLimit) {
        MultiHopQuery query = MultiHopQuery.of(queryText, maxHops, resultLimit);
        LOG.debugf("Multi-hop query: hops=%d, limit=%d", query.getMaxHops(), query.getResultLimit());
        MultiHopQueryResult result = Futures.await(engine.query(query));
        LOG.infof("Query answered with %d results in %.3fs (paths=%d, explored=%d, truncated=%s)",
            result.results().size(), result.executionTimeSeconds(), result.pathsFound(),
            result.totalPathsExplored(), result.truncated());
        return result;
    }
}
