package br.edu.ifba.graphqa.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Parameters of a multi-hop query.
 *
 * <p>Out-of-range {@code maxHops} and {@code resultLimit} values are clamped to
 * the nearest valid bound; missing values take the defaults. A blank query text
 * is rejected with {@link QueryValidationException}.</p>
 */
public final class MultiHopQuery {

    public static final int MIN_HOPS = 1;
    public static final int MAX_HOPS = 3;
    public static final int DEFAULT_MAX_HOPS = 2;

    public static final int MIN_RESULT_LIMIT = 1;
    public static final int MAX_RESULT_LIMIT = 100;
    public static final int DEFAULT_RESULT_LIMIT = 10;

    private final String queryText;
    private final int maxHops;
    private final int resultLimit;

    private MultiHopQuery(String queryText, int maxHops, int resultLimit) {
        this.queryText = queryText;
        this.maxHops = maxHops;
        this.resultLimit = resultLimit;
    }

    /**
     * Validates and normalizes raw request values.
     *
     * @param queryText free-text query (required, non-blank)
     * @param maxHops requested maximum hop depth, or null for the default
     * @param resultLimit requested number of results, or null for the default
     * @return the normalized query
     * @throws QueryValidationException if the query text is null or blank
     */
    public static MultiHopQuery of(@Nullable String queryText, @Nullable Integer maxHops,
                                   @Nullable Integer resultLimit) {
        if (queryText == null || queryText.isBlank()) {
            throw new QueryValidationException("query_text must not be empty");
        }
        int hops = maxHops == null ? DEFAULT_MAX_HOPS : clamp(maxHops, MIN_HOPS, MAX_HOPS);
        int limit = resultLimit == null
            ? DEFAULT_RESULT_LIMIT
            : clamp(resultLimit, MIN_RESULT_LIMIT, MAX_RESULT_LIMIT);
        return new MultiHopQuery(queryText.trim(), hops, limit);
    }

    public static MultiHopQuery of(@NotNull String queryText) {
        return of(queryText, null, null);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    @NotNull
    public String getQueryText() {
        return queryText;
    }

    public int getMaxHops() {
        return maxHops;
    }

    public int getResultLimit() {
        return resultLimit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MultiHopQuery that = (MultiHopQuery) o;
        return maxHops == that.maxHops && resultLimit == that.resultLimit && queryText.equals(that.queryText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(queryText, maxHops, resultLimit);
    }

    @Override
    public String toString() {
        return "MultiHopQuery{" +
               "queryText='" + queryText + '\'' +
               ", maxHops=" + maxHops +
               ", resultLimit=" + resultLimit +
               '}';
    }
}
