package br.edu.ifba.graphqa.query;

import br.edu.ifba.graphqa.core.AnswerResult;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Renders the answer sentence from the top-ranked results with fixed templates.
 */
public class AnswerSynthesizer {

    public static final String NO_ANSWER = "I couldn't find relevant information in the knowledge graph.";

    static final int MAX_NAMES = 3;

    private static final Pattern DEFINITION = Pattern.compile("\\b(what\\s+is|what\\s+are|define|definition)\\b");
    private static final Pattern PROCESS = Pattern.compile("\\b(how|process|procedure)\\b");
    private static final Pattern CAUSAL = Pattern.compile("\\b(why|reason|because)\\b");
    private static final Pattern IDENTIFICATION = Pattern.compile("\\b(who|which|what)\\b");

    private static final Pattern RELATION_IN_PATH = Pattern.compile("\\[([A-Z][A-Z0-9_]*)]");

    public String synthesize(@NotNull String queryText, @NotNull List<AnswerResult> results) {
        if (results.isEmpty()) {
            return NO_ANSWER;
        }
        List<String> names = topNames(results);
        String query = queryText.toLowerCase(Locale.ROOT);

        if (DEFINITION.matcher(query).find()) {
            return definition(names);
        }
        if (PROCESS.matcher(query).find()) {
            return process(names, firstRelation(results));
        }
        if (CAUSAL.matcher(query).find()) {
            return "Based on the knowledge graph, " + names.get(0)
                + " is causally related to other concepts through various relationships.";
        }
        if (IDENTIFICATION.matcher(query).find()) {
            if (names.size() == 1) {
                return "The relevant entity is " + names.get(0) + ".";
            }
            return "The relevant entities include: " + String.join(", ", names) + ".";
        }
        if (names.size() > 1) {
            return names.get(0) + " is related to " + names.get(1) + " and other concepts in the knowledge graph.";
        }
        return names.get(0) + " has various relationships with other concepts in the knowledge graph.";
    }

    private static String definition(List<String> names) {
        String main = names.get(0);
        if (names.size() == 1) {
            return main + " is a key concept in the knowledge graph with various relationships to other entities.";
        }
        return main + " is connected to " + String.join(", ", names.subList(1, names.size()))
            + " and other concepts in the knowledge graph.";
    }

    private static String process(List<String> names, String relation) {
        if (relation != null) {
            return "The process involves " + names.get(0) + " and is connected through relationships like "
                + relation + " in the knowledge graph.";
        }
        return "The process involves " + names.get(0) + " and related concepts in the knowledge graph.";
    }

    private static List<String> topNames(List<AnswerResult> results) {
        List<String> names = new ArrayList<>(MAX_NAMES);
        for (AnswerResult result : results) {
            if (!names.contains(result.answerEntity())) {
                names.add(result.answerEntity());
                if (names.size() == MAX_NAMES) {
                    break;
                }
            }
        }
        return names;
    }

    private static String firstRelation(List<AnswerResult> results) {
        var matcher = RELATION_IN_PATH.matcher(results.get(0).pathRendering());
        return matcher.find() ? matcher.group(1) : null;
    }
}
