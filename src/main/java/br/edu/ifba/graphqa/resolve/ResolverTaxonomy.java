package br.edu.ifba.graphqa.resolve;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Word lists driving entity mention detection. All words are held lower-case.
 *
 * @param orgIndicators words that mark a mention as an organization ("university", "inc", ...)
 * @param domainWords lower-case words accepted as mention tokens even when not capitalized
 * @param queryStopWords question words dropped before building n-grams
 * @param topicalStopWords extra words ignored when matching query tokens against entity names
 */
public record ResolverTaxonomy(
    Set<String> orgIndicators,
    Set<String> domainWords,
    Set<String> queryStopWords,
    Set<String> topicalStopWords
) {
    public ResolverTaxonomy {
        orgIndicators = lower(orgIndicators);
        domainWords = lower(domainWords);
        queryStopWords = lower(queryStopWords);
        topicalStopWords = lower(topicalStopWords);
    }

    public static ResolverTaxonomy defaults() {
        return new ResolverTaxonomy(
            Set.of("university", "company", "corporation", "institute", "college", "organization", "corp",
                "inc", "ltd", "limited", "llc", "plc", "gmbh", "associates", "partners", "group", "foundation",
                "bank", "solutions", "technologies", "systems", "services", "consulting", "center", "centre",
                "agency", "association", "society", "laboratory", "labs"),
            Set.of("university", "stanford"),
            Set.of("who", "what", "where", "when", "why", "how", "does", "is", "are", "the", "a", "an",
                "about", "tell", "me", "with"),
            Set.of("the", "a", "an", "is", "are", "what", "how", "theory", "principle", "of", "and", "in",
                "on", "for", "to", "who", "which", "was", "were", "does", "did"));
    }

    public boolean isOrgIndicator(String word) {
        return orgIndicators.contains(word.toLowerCase(Locale.ROOT));
    }

    public boolean isDomainWord(String word) {
        return domainWords.contains(word.toLowerCase(Locale.ROOT));
    }

    public boolean isQueryStopWord(String word) {
        return queryStopWords.contains(word.toLowerCase(Locale.ROOT));
    }

    /**
     * True for words ignored by topical matching: query stop words and topical stop words.
     */
    public boolean isTopicalStopWord(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        return topicalStopWords.contains(lower) || queryStopWords.contains(lower);
    }

    private static Set<String> lower(Collection<String> words) {
        return words.stream()
            .map(w -> w.trim().toLowerCase(Locale.ROOT))
            .filter(w -> !w.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
    }
}
