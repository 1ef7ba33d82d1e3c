package br.edu.ifba.graphqa.centrality;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration of centrality computation and its scheduled refresh.
 *
 * <pre>
 * kgqa.centrality.damping-factor=0.85
 * kgqa.centrality.max-iterations=100
 * kgqa.centrality.tolerance=1e-6
 * kgqa.centrality.min-score=1e-4
 * kgqa.centrality.top-k=20
 * kgqa.centrality.directed=false
 * kgqa.centrality.refresh.every=off
 * </pre>
 */
@ConfigMapping(prefix = "kgqa.centrality")
public interface CentralityConfig {

    @WithDefault("0.85")
    double dampingFactor();

    @WithDefault("100")
    int maxIterations();

    @WithDefault("1e-6")
    double tolerance();

    @WithDefault("1e-4")
    double minScore();

    @WithDefault("20")
    int topK();

    /**
     * Walk relations only from source to target. Off by default: relations count
     * as links between both endpoints.
     */
    @WithDefault("false")
    boolean directed();

    Refresh refresh();

    interface Refresh {

        /**
         * Interval of the background recomputation, e.g. {@code 6h}; {@code off} disables it.
         */
        @WithDefault("off")
        String every();
    }

    default CentralityOptions toOptions() {
        return new CentralityOptions(dampingFactor(), maxIterations(), tolerance(), minScore(), topK(), directed());
    }
}
