package br.edu.ifba.graphqa.intent;

import br.edu.ifba.graphqa.core.ExpectedAnswerType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Expected answer type of a query with its diagnostics.
 *
 * @param expectedType classified type; MULTIPLE when several categories are close
 * @param primaryType highest-scoring category, UNKNOWN when nothing matched
 * @param possibleTypes other categories close to the primary one (MULTIPLE only)
 * @param confidence min(1, max category score / 2), 0 for UNKNOWN
 * @param categoryScores aggregate score of every category
 * @param matchedRules descriptions of the rules that fired
 */
public record IntentAnalysis(
    @JsonProperty("expected_type") ExpectedAnswerType expectedType,
    @JsonProperty("primary_type") ExpectedAnswerType primaryType,
    @JsonProperty("possible_types") List<ExpectedAnswerType> possibleTypes,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("category_scores") Map<String, Double> categoryScores,
    @JsonProperty("matched_rules") List<String> matchedRules
) {
    public IntentAnalysis {
        possibleTypes = List.copyOf(possibleTypes);
        categoryScores = Map.copyOf(categoryScores);
        matchedRules = List.copyOf(matchedRules);
    }

    public static IntentAnalysis unknown() {
        return new IntentAnalysis(ExpectedAnswerType.UNKNOWN, ExpectedAnswerType.UNKNOWN, List.of(), 0.0,
            Map.of(), List.of());
    }

    public boolean isUnknown() {
        return expectedType == ExpectedAnswerType.UNKNOWN;
    }
}
