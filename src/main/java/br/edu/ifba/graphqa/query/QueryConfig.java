package br.edu.ifba.graphqa.query;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Configuration of multi-hop query execution.
 *
 * <pre>
 * kgqa.query.per-call-limit=50
 * kgqa.query.deep-per-call-limit=30
 * kgqa.query.early-exit-factor=2
 * kgqa.query.timeout=5s
 * kgqa.query.max-visited-nodes=10000
 * kgqa.query.path-weight=0.3
 * kgqa.query.relevance-weight=0.7
 * kgqa.query.boost-factor=2.0
 * kgqa.query.max-candidates=10
 * kgqa.query.scan-limit=100
 * </pre>
 */
@ConfigMapping(prefix = "kgqa.query")
public interface QueryConfig {

    @WithDefault("50")
    int perCallLimit();

    @WithDefault("30")
    int deepPerCallLimit();

    @WithDefault("2")
    int earlyExitFactor();

    @WithDefault("5s")
    Duration timeout();

    @WithDefault("10000")
    int maxVisitedNodes();

    @WithDefault("0.3")
    double pathWeight();

    @WithDefault("0.7")
    double relevanceWeight();

    @WithDefault("2.0")
    double boostFactor();

    @WithDefault("10")
    int maxCandidates();

    @WithDefault("100")
    int scanLimit();

    default QueryOptions toOptions() {
        return new QueryOptions(perCallLimit(), deepPerCallLimit(), earlyExitFactor(), timeout(), maxVisitedNodes(),
            pathWeight(), relevanceWeight(), boostFactor(), maxCandidates(), scanLimit());
    }
}
