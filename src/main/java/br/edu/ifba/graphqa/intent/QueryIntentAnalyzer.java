package br.edu.ifba.graphqa.intent;

import br.edu.ifba.graphqa.core.Entity;
import br.edu.ifba.graphqa.core.EntityCategory;
import br.edu.ifba.graphqa.core.ExpectedAnswerType;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static br.edu.ifba.graphqa.intent.IntentRule.boost;
import static br.edu.ifba.graphqa.intent.IntentRule.primary;

/**
 * Predicts the answer type a query asks for from weighted lexical rules.
 *
 * <p>Each category sums the weights of its matched question patterns and then adds
 * its matched context boosts. The top category wins; when another category reaches
 * 80% of the top score and exceeds 0.5 the query is classified as MULTIPLE.</p>
 */
public class QueryIntentAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(QueryIntentAnalyzer.class);

    static final double MULTIPLE_RATIO = 0.8;
    static final double MULTIPLE_MIN_SCORE = 0.5;

    static final double COMPATIBLE_BASE = 0.7;
    static final double UNDECIDED_BASE = 0.3;
    static final double ECHO_PENALTY = 0.5;
    static final double CENTRALITY_FACTOR = 10.0;
    static final double CENTRALITY_CAP = 0.3;

    private static final List<IntentRule> DEFAULT_RULES = List.of(
        primary(EntityCategory.PERSON, "\\bwho\\b", 0.9),
        primary(EntityCategory.PERSON, "\\bwhom\\b", 0.9),
        primary(EntityCategory.PERSON, "\\bwhose\\b", 0.7),
        primary(EntityCategory.PERSON, "\\b(person|people|individual)\\b", 0.5),
        primary(EntityCategory.PERSON, "\\b(founded|invented|discovered|wrote|authored|created)\\b", 0.3),
        boost(EntityCategory.PERSON,
            "\\b(ceo|founder|president|director|author|inventor|scientist|researcher|professor|chairman)s?\\b", 0.3),

        primary(EntityCategory.ORGANIZATION,
            "\\b(which|what)\\s+(company|organi[sz]ation|institution|university|firm|agency)\\b", 0.9),
        primary(EntityCategory.ORGANIZATION,
            "\\b(company|companies|organi[sz]ation|institution|corporation|agency|firm|university)\\b", 0.5),
        primary(EntityCategory.ORGANIZATION, "\\b(works?|worked|working)\\s+(at|for)\\b", 0.6),
        primary(EntityCategory.ORGANIZATION, "\\b(employer|employed\\s+by)\\b", 0.6),
        boost(EntityCategory.ORGANIZATION, "\\b(subsidiary|merger|acquired|employees)\\b", 0.2),

        primary(EntityCategory.LOCATION, "\\bwhere\\b", 0.9),
        primary(EntityCategory.LOCATION, "\\bheadquartered\\b", 0.9),
        primary(EntityCategory.LOCATION, "\\b(located|situated)\\b", 0.7),
        primary(EntityCategory.LOCATION, "\\b(city|country|state|region|place|continent)\\b", 0.5),
        primary(EntityCategory.LOCATION, "\\bborn\\s+in\\b", 0.4),
        boost(EntityCategory.LOCATION, "\\b(headquarters|capital|address)\\b", 0.2),

        primary(EntityCategory.DATE, "\\bwhen\\b", 0.9),
        primary(EntityCategory.DATE, "\\b(what|which)\\s+year\\b", 0.9),
        primary(EntityCategory.DATE, "\\bhow\\s+long\\s+ago\\b", 0.7),
        primary(EntityCategory.DATE, "\\b(date|year|century|decade)\\b", 0.5),
        boost(EntityCategory.DATE, "\\b(anniversary|timeline|era)\\b", 0.2),

        primary(EntityCategory.NUMBER, "\\bhow\\s+(many|much)\\b", 0.9),
        primary(EntityCategory.NUMBER, "\\b(number|count|total|amount|quantity)\\s+of\\b", 0.7),
        primary(EntityCategory.NUMBER, "\\b(percentage|percent|ratio|population)\\b", 0.5),
        boost(EntityCategory.NUMBER, "\\b(revenue|budget|cost|price)\\b", 0.2),

        primary(EntityCategory.EVENT, "\\bwhat\\s+happened\\b", 0.9),
        primary(EntityCategory.EVENT,
            "\\b(event|conference|war|battle|election|summit|meeting|ceremony|festival)s?\\b", 0.5),
        primary(EntityCategory.EVENT, "\\bduring\\b", 0.4),
        boost(EntityCategory.EVENT, "\\b(took\\s+place|occurred|held)\\b", 0.2)
    );

    private final List<IntentRule> rules;

    public QueryIntentAnalyzer() {
        this(DEFAULT_RULES);
    }

    public QueryIntentAnalyzer(@NotNull List<IntentRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Classifies the expected answer type of a query.
     */
    public IntentAnalysis analyze(@NotNull String queryText) {
        Map<EntityCategory, Double> scores = new EnumMap<>(EntityCategory.class);
        for (EntityCategory category : EntityCategory.values()) {
            scores.put(category, 0.0);
        }
        List<String> matched = new ArrayList<>();
        for (IntentRule rule : rules) {
            if (rule.matches(queryText)) {
                scores.merge(rule.category(), rule.weight(), Double::sum);
                matched.add(rule.describe());
            }
        }

        Map<String, Double> reported = new LinkedHashMap<>();
        scores.forEach((category, score) -> reported.put(category.name(), score));

        // EnumMap iteration order makes ties resolve to the earlier category.
        EntityCategory top = null;
        double max = 0.0;
        for (Map.Entry<EntityCategory, Double> entry : scores.entrySet()) {
            if (entry.getValue() > max) {
                max = entry.getValue();
                top = entry.getKey();
            }
        }

        if (top == null) {
            logger.debug("No intent rule matched query '{}'", queryText);
            return new IntentAnalysis(ExpectedAnswerType.UNKNOWN, ExpectedAnswerType.UNKNOWN, List.of(), 0.0,
                reported, matched);
        }

        EntityCategory primaryCategory = top;
        double maxScore = max;
        List<ExpectedAnswerType> possible = scores.entrySet().stream()
            .filter(e -> e.getKey() != primaryCategory)
            .filter(e -> e.getValue() >= MULTIPLE_RATIO * maxScore && e.getValue() > MULTIPLE_MIN_SCORE)
            .sorted(Map.Entry.<EntityCategory, Double>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .map(e -> ExpectedAnswerType.of(e.getKey()))
            .toList();

        ExpectedAnswerType primaryType = ExpectedAnswerType.of(primaryCategory);
        ExpectedAnswerType expected = possible.isEmpty() ? primaryType : ExpectedAnswerType.MULTIPLE;
        double confidence = Math.min(1.0, maxScore / 2.0);

        logger.debug("Query '{}' classified as {} (primary {}, confidence {})",
            queryText, expected, primaryType, confidence);
        return new IntentAnalysis(expected, primaryType, possible, confidence, reported, matched);
    }

    /**
     * Literal graph type tags accepted for an expected type.
     * MULTIPLE and UNKNOWN accept any type, signalled by an empty set.
     */
    public static Set<String> compatibleEntityTypes(@NotNull ExpectedAnswerType type) {
        return type.category().map(EntityCategory::typeTags).orElse(Set.of());
    }

    /**
     * Scores how plausible {@code entity} is as an answer of the given type.
     *
     * <p>0.7 for a compatible type, 0.3 when the type is UNKNOWN or MULTIPLE, else 0;
     * halved when the entity's name already appears in the query; plus up to 0.3
     * from centrality (score times 10). Always within [0,1].</p>
     */
    public double scoreAnswerRelevance(@NotNull Entity entity, @NotNull ExpectedAnswerType expectedType,
                                       @NotNull String queryText) {
        double score;
        if (!expectedType.isSpecific()) {
            score = UNDECIDED_BASE;
        } else if (compatibleEntityTypes(expectedType).contains(entity.getEntityType())) {
            score = COMPATIBLE_BASE;
        } else {
            score = 0.0;
        }

        String name = entity.getCanonicalName().toLowerCase(Locale.ROOT);
        if (!name.isBlank() && queryText.toLowerCase(Locale.ROOT).contains(name)) {
            score *= ECHO_PENALTY;
        }

        double centrality = entity.centralityOrZero();
        if (Double.isFinite(centrality) && centrality > 0.0) {
            score += Math.min(CENTRALITY_CAP, centrality * CENTRALITY_FACTOR);
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
