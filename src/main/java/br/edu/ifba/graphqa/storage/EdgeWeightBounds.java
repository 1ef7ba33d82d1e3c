package br.edu.ifba.graphqa.storage;

/**
 * Bounds every stored relation weight is kept within.
 *
 * @param min lowest allowed weight
 * @param max highest allowed weight
 * @param defaultWeight weight used when a relation carries none
 */
public record EdgeWeightBounds(double min, double max, double defaultWeight) {

    public static final EdgeWeightBounds DEFAULT = new EdgeWeightBounds(0.01, 1.0, 0.5);

    public EdgeWeightBounds {
        if (!(min > 0.0) || min > max) {
            throw new IllegalArgumentException("Invalid weight bounds [" + min + ", " + max + "]");
        }
        if (defaultWeight < min || defaultWeight > max) {
            throw new IllegalArgumentException("Default weight " + defaultWeight + " outside bounds");
        }
    }

    public double clamp(double weight) {
        if (Double.isNaN(weight)) {
            return defaultWeight;
        }
        return Math.max(min, Math.min(max, weight));
    }
}
