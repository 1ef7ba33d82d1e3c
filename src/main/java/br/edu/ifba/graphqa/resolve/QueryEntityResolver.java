package br.edu.ifba.graphqa.resolve;

import br.edu.ifba.graphqa.core.Candidate;
import br.edu.ifba.graphqa.core.Entity;
import br.edu.ifba.graphqa.core.EntityCategory;
import br.edu.ifba.graphqa.core.ExpectedAnswerType;
import br.edu.ifba.graphqa.intent.IntentAnalysis;
import br.edu.ifba.graphqa.storage.GraphStorage;
import br.edu.ifba.graphqa.storage.TypeFilter;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the graph entities a query mentions.
 *
 * <p>Resolution runs in two passes. The topical pass scans a bounded slice of the
 * entity table and scores names against the query tokens; when it finds anything,
 * its candidates are returned directly. Otherwise the n-gram pass extracts mention
 * substrings from the query and looks each one up by exact name, falling back to a
 * bounded substring match.</p>
 */
public class QueryEntityResolver {

    private static final Logger logger = LoggerFactory.getLogger(QueryEntityResolver.class);

    public static final int DEFAULT_MAX_CANDIDATES = 10;
    public static final int DEFAULT_SCAN_LIMIT = 100;

    static final int TOPICAL_MAX_CANDIDATES = 5;
    static final int MIN_TOKEN_LENGTH = 3;

    static final double WHOLE_NAME_QUALITY = 0.9;
    static final double ACRONYM_QUALITY = 0.85;
    static final double OVERLAP_BASE_QUALITY = 0.5;
    static final double OVERLAP_RANGE = 0.4;
    static final double PARTIAL_WORD_QUALITY = 0.6;

    static final int EXACT_LIMIT = 3;
    static final double EXACT_QUALITY = 1.0;
    static final int SUBSTRING_LIMIT = 3;
    static final int SUBSTRING_MIN_LENGTH = 4;
    static final double SUBSTRING_MAX_LENGTH_RATIO = 2.0;
    static final double SUBSTRING_QUALITY = 0.8;

    private static final Pattern WORD_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern ACRONYM = Pattern.compile("\\(([\\p{L}\\p{N}]{2,})\\)");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");

    static final Comparator<Candidate> CANDIDATE_ORDER = Comparator
        .comparingDouble(Candidate::matchQuality).reversed()
        .thenComparing(Comparator.comparingInt((Candidate c) -> c.matchedText().length()).reversed())
        .thenComparing(Candidate::entityId);

    private final GraphStorage graphStorage;
    private final ResolverTaxonomy taxonomy;
    private final int maxCandidates;
    private final int scanLimit;

    public QueryEntityResolver(@NotNull GraphStorage graphStorage) {
        this(graphStorage, ResolverTaxonomy.defaults(), DEFAULT_MAX_CANDIDATES, DEFAULT_SCAN_LIMIT);
    }

    public QueryEntityResolver(@NotNull GraphStorage graphStorage, @NotNull ResolverTaxonomy taxonomy,
                               int maxCandidates, int scanLimit) {
        if (maxCandidates < 1 || scanLimit < 0) {
            throw new IllegalArgumentException(
                "maxCandidates must be >= 1 and scanLimit >= 0: " + maxCandidates + ", " + scanLimit);
        }
        this.graphStorage = graphStorage;
        this.taxonomy = taxonomy;
        this.maxCandidates = maxCandidates;
        this.scanLimit = scanLimit;
    }

    /**
     * Resolves the entities mentioned by {@code queryText}.
     *
     * @param queryText the question
     * @param intent intent of the question; MULTIPLE disables mention type filtering
     * @return at most {@code maxCandidates} candidates, unique by entity id, best first
     */
    public CompletableFuture<List<Candidate>> resolve(@NotNull String queryText, @NotNull IntentAnalysis intent) {
        return topicalPass(queryText).thenCompose(topical -> {
            if (!topical.isEmpty()) {
                logger.debug("Topical pass resolved {} candidate(s) for '{}'", topical.size(), queryText);
                return CompletableFuture.completedFuture(topical);
            }
            return ngramPass(queryText, intent);
        });
    }

    // ===== Topical pass =====

    CompletableFuture<List<Candidate>> topicalPass(String queryText) {
        Set<String> tokens = topicalTokens(queryText);
        if (tokens.isEmpty() || scanLimit == 0) {
            return CompletableFuture.completedFuture(List.of());
        }
        String queryLower = queryText.toLowerCase(Locale.ROOT);
        return graphStorage.scanEntities(scanLimit).thenApply(entities -> {
            List<Candidate> matches = new ArrayList<>();
            for (Entity entity : entities) {
                Candidate candidate = topicalMatch(entity, queryLower, tokens);
                if (candidate != null) {
                    matches.add(candidate);
                }
            }
            return finish(matches, TOPICAL_MAX_CANDIDATES);
        });
    }

    Set<String> topicalTokens(String queryText) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String word : WORD_SPLIT.split(queryText.toLowerCase(Locale.ROOT))) {
            if (word.length() >= MIN_TOKEN_LENGTH && !taxonomy.isTopicalStopWord(word)) {
                tokens.add(word);
            }
        }
        return tokens;
    }

    private Candidate topicalMatch(Entity entity, String queryLower, Set<String> tokens) {
        String name = entity.getCanonicalName();
        String nameLower = name.toLowerCase(Locale.ROOT).trim();
        if (nameLower.length() >= MIN_TOKEN_LENGTH && queryLower.contains(nameLower)) {
            return Candidate.of(entity, name, WHOLE_NAME_QUALITY);
        }

        Matcher acronym = ACRONYM.matcher(name);
        while (acronym.find()) {
            String letters = acronym.group(1).toLowerCase(Locale.ROOT);
            if (tokens.contains(letters)) {
                return Candidate.of(entity, letters, ACRONYM_QUALITY);
            }
        }

        List<String> nameWords = Arrays.stream(WORD_SPLIT.split(nameLower))
            .filter(w -> !w.isEmpty() && !taxonomy.isTopicalStopWord(w))
            .distinct()
            .toList();
        if (nameWords.isEmpty()) {
            return null;
        }
        List<String> overlap = nameWords.stream().filter(tokens::contains).toList();
        if (!overlap.isEmpty()) {
            double quality = OVERLAP_BASE_QUALITY + OVERLAP_RANGE * overlap.size() / nameWords.size();
            return Candidate.of(entity, String.join(" ", overlap), Math.min(1.0, quality));
        }

        for (String token : tokens) {
            for (String word : nameWords) {
                if (word.length() > token.length() && word.contains(token)) {
                    return Candidate.of(entity, token, PARTIAL_WORD_QUALITY);
                }
            }
        }
        return null;
    }

    // ===== N-gram pass =====

    CompletableFuture<List<Candidate>> ngramPass(String queryText, IntentAnalysis intent) {
        List<String> mentions = extractMentions(queryText);
        if (mentions.isEmpty()) {
            logger.debug("No mention candidates found in '{}'", queryText);
            return CompletableFuture.completedFuture(List.of());
        }
        boolean multiple = intent.expectedType() == ExpectedAnswerType.MULTIPLE;

        List<CompletableFuture<List<Candidate>>> lookups = new ArrayList<>(mentions.size());
        for (String mention : mentions) {
            TypeFilter filter = multiple ? TypeFilter.none() : mentionFilter(mention);
            lookups.add(lookup(mention, filter));
        }
        return CompletableFuture.allOf(lookups.toArray(new CompletableFuture[0])).thenApply(ignored -> {
            List<Candidate> all = new ArrayList<>();
            lookups.forEach(f -> all.addAll(f.join()));
            List<Candidate> result = finish(all, maxCandidates);
            logger.debug("N-gram pass resolved {} candidate(s) from {} mention(s) for '{}'",
                result.size(), mentions.size(), queryText);
            return result;
        });
    }

    /**
     * Extracts mention substrings: capitalized or whitelisted 1-grams, 2- and 3-grams
     * containing such a word, and names following "at". Unique ignoring case.
     * Grams are built over the words as they appear, so they never join words the
     * query keeps apart; stop words only disqualify a 1-gram or an all-stop-word gram.
     */
    List<String> extractMentions(String queryText) {
        List<String> words = new ArrayList<>();
        for (String raw : queryText.trim().split("\\s+")) {
            String word = EDGE_PUNCTUATION.matcher(raw).replaceAll("");
            if (!word.isEmpty()) {
                words.add(word);
            }
        }

        Map<String, String> mentions = new LinkedHashMap<>();
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i);
            if (isMentionWord(word) && (taxonomy.isDomainWord(word) || word.length() > 2)) {
                addMention(mentions, word);
            }
            for (int n = 2; n <= 3 && i + n <= words.size(); n++) {
                List<String> gram = words.subList(i, i + n);
                if (gram.stream().anyMatch(this::isMentionWord)) {
                    addMention(mentions, String.join(" ", gram));
                }
            }
            if (word.equalsIgnoreCase("at") && i + 1 < words.size() && isCapitalized(words.get(i + 1))) {
                addMention(mentions, words.get(i + 1));
                if (i + 2 < words.size() && isCapitalized(words.get(i + 2))) {
                    addMention(mentions, words.get(i + 1) + " " + words.get(i + 2));
                }
            }
        }
        return List.copyOf(mentions.values());
    }

    // A word that can anchor a mention: not a stop word, and capitalized or whitelisted.
    private boolean isMentionWord(String word) {
        return !taxonomy.isQueryStopWord(word) && (isCapitalized(word) || taxonomy.isDomainWord(word));
    }

    /**
     * Type restriction for one mention: organization tags when it contains an
     * organization indicator, person tags when it is several capitalized words,
     * otherwise none.
     */
    TypeFilter mentionFilter(String mention) {
        String[] words = mention.split("\\s+");
        if (Arrays.stream(words).anyMatch(taxonomy::isOrgIndicator)) {
            return TypeFilter.of(EntityCategory.ORGANIZATION);
        }
        if (words.length > 1 && Arrays.stream(words).allMatch(QueryEntityResolver::isCapitalized)) {
            return TypeFilter.of(EntityCategory.PERSON);
        }
        return TypeFilter.none();
    }

    private CompletableFuture<List<Candidate>> lookup(String mention, TypeFilter filter) {
        return graphStorage.getByExactName(mention, filter, EXACT_LIMIT).thenCompose(exact -> {
            if (!exact.isEmpty()) {
                return CompletableFuture.completedFuture(toCandidates(exact, mention, EXACT_QUALITY));
            }
            if (mention.length() < SUBSTRING_MIN_LENGTH) {
                return CompletableFuture.completedFuture(List.<Candidate>of());
            }
            return graphStorage.getBySubstring(mention, filter, SUBSTRING_MAX_LENGTH_RATIO, SUBSTRING_LIMIT)
                .thenApply(partial -> toCandidates(partial, mention, SUBSTRING_QUALITY));
        });
    }

    // ===== Helpers =====

    private static List<Candidate> toCandidates(List<Entity> entities, String mention, double quality) {
        return entities.stream().map(e -> Candidate.of(e, mention, quality)).toList();
    }

    /**
     * Sorts, keeps the best candidate per entity id and caps the list.
     */
    static List<Candidate> finish(List<Candidate> candidates, int cap) {
        List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(CANDIDATE_ORDER);
        Map<String, Candidate> unique = new LinkedHashMap<>();
        for (Candidate candidate : sorted) {
            unique.putIfAbsent(candidate.entityId(), candidate);
            if (unique.size() == cap) {
                break;
            }
        }
        return List.copyOf(unique.values());
    }

    private static void addMention(Map<String, String> mentions, String mention) {
        mentions.putIfAbsent(mention.toLowerCase(Locale.ROOT), mention);
    }

    private static boolean isCapitalized(String word) {
        return !word.isEmpty() && Character.isUpperCase(word.codePointAt(0));
    }
}
