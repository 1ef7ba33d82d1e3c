package br.edu.ifba.graphqa.intent;

import br.edu.ifba.graphqa.core.EntityCategory;

import java.util.regex.Pattern;

/**
 * A weighted lexical pattern voting for one answer category.
 *
 * @param category category the rule votes for
 * @param pattern case-insensitive pattern matched against the query
 * @param weight score added to the category when the pattern is found
 * @param boost true for flat context bonuses, false for primary question patterns
 */
public record IntentRule(EntityCategory category, Pattern pattern, double weight, boolean boost) {

    static IntentRule primary(EntityCategory category, String regex, double weight) {
        return new IntentRule(category, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), weight, false);
    }

    static IntentRule boost(EntityCategory category, String regex, double weight) {
        return new IntentRule(category, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), weight, true);
    }

    public boolean matches(String query) {
        return pattern.matcher(query).find();
    }

    public String describe() {
        return category + (boost ? " boost " : " ") + pattern.pattern() + " (" + weight + ")";
    }
}
