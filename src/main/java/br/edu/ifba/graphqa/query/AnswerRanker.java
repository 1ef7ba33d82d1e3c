package br.edu.ifba.graphqa.query;

import br.edu.ifba.graphqa.core.AnswerResult;
import br.edu.ifba.graphqa.core.Entity;
import br.edu.ifba.graphqa.core.ExpectedAnswerType;
import br.edu.ifba.graphqa.core.GraphPath;
import br.edu.ifba.graphqa.intent.QueryIntentAnalyzer;
import br.edu.ifba.graphqa.storage.GraphStorage;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Turns paths into ranked answers.
 *
 * <p>The answer endpoints of all paths are fetched in one store round trip so the
 * relevance of each answer can use its stored type and centrality. The final
 * score blends the raw path score with that relevance; ties are ordered by entity
 * id and then by path rendering.</p>
 */
public class AnswerRanker {

    private static final Logger logger = LoggerFactory.getLogger(AnswerRanker.class);

    static final double MAX_CONFIDENCE = 0.95;

    static final Comparator<AnswerResult> RESULT_ORDER = Comparator
        .comparingDouble(AnswerResult::finalScore).reversed()
        .thenComparing(AnswerResult::entityId)
        .thenComparing(AnswerResult::pathRendering);

    private final GraphStorage graphStorage;
    private final QueryIntentAnalyzer intentAnalyzer;
    private final QueryOptions options;

    public AnswerRanker(@NotNull GraphStorage graphStorage, @NotNull QueryIntentAnalyzer intentAnalyzer,
                        @NotNull QueryOptions options) {
        this.graphStorage = graphStorage;
        this.intentAnalyzer = intentAnalyzer;
        this.options = options;
    }

    /**
     * Ranks the answers of {@code paths}.
     *
     * @param paths paths found for the query
     * @param expectedType expected answer type of the query
     * @param queryText the question
     * @param resultLimit number of answers kept
     * @return at most {@code resultLimit} answers ranked from 1
     */
    public CompletableFuture<List<AnswerResult>> rank(@NotNull List<GraphPath> paths,
                                                      @NotNull ExpectedAnswerType expectedType,
                                                      @NotNull String queryText, int resultLimit) {
        if (paths.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        Set<String> names = new LinkedHashSet<>();
        paths.forEach(p -> names.add(p.answerName()));

        return graphStorage.bulkGetByName(names).thenApply(entities -> {
            Map<String, Entity> byId = new HashMap<>();
            Map<String, Entity> firstByName = new HashMap<>();
            for (Entity entity : entities) {
                byId.put(entity.getId(), entity);
                firstByName.merge(entity.getCanonicalName(), entity,
                    (a, b) -> a.getId().compareTo(b.getId()) <= 0 ? a : b);
            }

            Set<String> compatible = QueryIntentAnalyzer.compatibleEntityTypes(expectedType);
            List<AnswerResult> results = new ArrayList<>(paths.size());
            for (GraphPath path : paths) {
                Entity answer = endpoint(path, byId, firstByName);
                results.add(score(path, answer, expectedType, compatible, queryText));
            }
            results.sort(RESULT_ORDER);

            int kept = Math.min(resultLimit, results.size());
            List<AnswerResult> ranked = new ArrayList<>(kept);
            for (int i = 0; i < kept; i++) {
                ranked.add(results.get(i).withRank(i + 1));
            }
            logger.debug("Ranked {} paths into {} answers", paths.size(), ranked.size());
            return ranked;
        });
    }

    private AnswerResult score(GraphPath path, Entity answer, ExpectedAnswerType expectedType,
                               Set<String> compatible, String queryText) {
        double raw = clamp(path.rawScore());
        double relevance = expectedType == ExpectedAnswerType.UNKNOWN
            ? Math.min(1.0, raw * options.boostFactor())
            : intentAnalyzer.scoreAnswerRelevance(answer, expectedType, queryText);
        double finalScore = clamp(options.pathWeight() * raw + options.relevanceWeight() * relevance);
        boolean typeMatch = compatible.isEmpty() || compatible.contains(answer.getEntityType());

        return new AnswerResult(
            0,
            answer.getCanonicalName(),
            answer.getId(),
            answer.getEntityType(),
            path.render(),
            path.hops(),
            path.evidence(),
            raw,
            relevance,
            finalScore,
            Math.min(MAX_CONFIDENCE, finalScore),
            typeMatch);
    }

    private static Entity endpoint(GraphPath path, Map<String, Entity> byId, Map<String, Entity> firstByName) {
        Entity entity = byId.get(path.answerId());
        if (entity == null) {
            entity = firstByName.get(path.answerName());
        }
        if (entity == null) {
            entity = Entity.builder().id(path.answerId()).canonicalName(path.answerName()).build();
        }
        return entity;
    }

    private static double clamp(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
