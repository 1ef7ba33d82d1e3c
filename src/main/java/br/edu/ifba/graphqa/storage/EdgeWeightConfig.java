package br.edu.ifba.graphqa.storage;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Relation weight bounds applied by the graph stores.
 *
 * <pre>
 * kgqa.graph.weight.min=0.01
 * kgqa.graph.weight.max=1.0
 * kgqa.graph.weight.default=0.5
 * </pre>
 */
@ConfigMapping(prefix = "kgqa.graph.weight")
public interface EdgeWeightConfig {

    @WithDefault("0.01")
    double min();

    @WithDefault("1.0")
    double max();

    @WithName("default")
    @WithDefault("0.5")
    double defaultWeight();

    default EdgeWeightBounds toBounds() {
        return new EdgeWeightBounds(min(), max(), defaultWeight());
    }
}
