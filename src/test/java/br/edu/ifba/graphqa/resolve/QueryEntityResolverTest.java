package br.edu.ifba.graphqa.resolve;

import br.edu.ifba.graphqa.GraphFixtures;
import br.edu.ifba.graphqa.core.Candidate;
import br.edu.ifba.graphqa.core.EntityCategory;
import br.edu.ifba.graphqa.core.ExpectedAnswerType;
import br.edu.ifba.graphqa.intent.IntentAnalysis;
import br.edu.ifba.graphqa.storage.TypeFilter;
import br.edu.ifba.graphqa.storage.impl.InMemoryGraphStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static br.edu.ifba.graphqa.GraphFixtures.entity;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryEntityResolverTest {

    private InMemoryGraphStorage storage;
    private QueryEntityResolver resolver;

    @BeforeEach
    void setUp() {
        storage = new InMemoryGraphStorage();
        storage.initialize().join();
        resolver = new QueryEntityResolver(storage);
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    private static IntentAnalysis multiple() {
        return new IntentAnalysis(ExpectedAnswerType.MULTIPLE, ExpectedAnswerType.ORGANIZATION,
            List.of(ExpectedAnswerType.PERSON), 0.7, Map.of(), List.of());
    }

    @Nested
    @DisplayName("topical pass")
    class TopicalPass {

        @Test
        @DisplayName("should rank a whole-name mention above word overlaps")
        void shouldRankWholeNameFirst() {
            GraphFixtures.seedCarterGraph(storage);

            List<Candidate> candidates = resolver.resolve("Who founded the Carter Center?",
                IntentAnalysis.unknown()).join();

            assertEquals(List.of("o1", "p1", "p2"), candidates.stream().map(Candidate::entityId).toList());
            assertEquals(0.9, candidates.get(0).matchQuality(), 1e-9);
            assertEquals("Carter Center", candidates.get(0).matchedText());
            assertEquals(0.7, candidates.get(1).matchQuality(), 1e-9);
            assertEquals("carter", candidates.get(1).matchedText());
        }

        @Test
        @DisplayName("should match a parenthesized acronym")
        void shouldMatchAcronym() {
            storage.upsertEntities(List.of(
                entity("n1", "National Aeronautics and Space Administration (NASA)", "ORGANIZATION"))).join();

            List<Candidate> candidates = resolver.topicalPass("What did NASA launch?").join();

            assertEquals(1, candidates.size());
            assertEquals(0.85, candidates.get(0).matchQuality(), 1e-9);
            assertEquals("nasa", candidates.get(0).matchedText());
        }

        @Test
        @DisplayName("should match a token contained in a longer name word")
        void shouldMatchPartialWord() {
            storage.upsertEntities(List.of(entity("b1", "Photosynthesis", "PROCESS"))).join();

            List<Candidate> candidates = resolver.topicalPass("explain photosynth").join();

            assertEquals(1, candidates.size());
            assertEquals(0.6, candidates.get(0).matchQuality(), 1e-9);
        }

        @Test
        @DisplayName("should ignore stop words and short tokens")
        void shouldIgnoreStopWords() {
            assertTrue(resolver.topicalTokens("What is the theory of it?").isEmpty());
            assertEquals(List.of("founded", "carter", "center"),
                List.copyOf(resolver.topicalTokens("Who founded the Carter Center?")));
        }

        @Test
        @DisplayName("should keep at most five topical candidates")
        void shouldCapTopicalCandidates() {
            for (int i = 0; i < 8; i++) {
                storage.upsertEntities(List.of(entity("r" + i, "River " + i, "LOCATION"))).join();
            }

            List<Candidate> candidates = resolver.topicalPass("Which river floods?").join();

            assertEquals(QueryEntityResolver.TOPICAL_MAX_CANDIDATES, candidates.size());
        }
    }

    @Nested
    @DisplayName("n-gram pass")
    class NgramPass {

        @Test
        @DisplayName("should return every entity sharing an ambiguous name")
        void shouldReturnAmbiguousMatches() {
            storage.upsertEntities(List.of(
                entity("m1", "Mercury", "PLANET"),
                entity("m2", "Mercury", "ELEMENT"))).join();

            List<Candidate> candidates = resolver.ngramPass("Tell me about Mercury", IntentAnalysis.unknown()).join();

            assertEquals(List.of("m1", "m2"), candidates.stream().map(Candidate::entityId).toList());
            assertTrue(candidates.stream().allMatch(c -> c.matchQuality() == 1.0));
        }

        @Test
        @DisplayName("should fall back to bounded substring matches")
        void shouldFallBackToSubstring() {
            storage.upsertEntities(List.of(entity("o1", "Microsoft Research", "ORGANIZATION"))).join();

            List<Candidate> candidates = resolver.ngramPass("papers from Microsoft", IntentAnalysis.unknown()).join();

            assertEquals(1, candidates.size());
            assertEquals(0.8, candidates.get(0).matchQuality(), 1e-9);
            assertEquals("Microsoft", candidates.get(0).matchedText());
        }

        @Test
        @DisplayName("should drop type filters when the intent is MULTIPLE")
        void shouldDropFiltersForMultipleIntent() {
            storage.upsertEntities(List.of(entity("f1", "Stanford Linear Accelerator", "FACILITY"))).join();
            String query = "Stanford Linear Accelerator";

            List<Candidate> filtered = resolver.ngramPass(query, IntentAnalysis.unknown()).join();
            List<Candidate> unfiltered = resolver.ngramPass(query, multiple()).join();

            assertTrue(filtered.isEmpty());
            assertEquals(1, unfiltered.size());
            assertEquals("f1", unfiltered.get(0).entityId());
        }

        @Test
        @DisplayName("should find a name that contains a stop word")
        void shouldResolveNameWithStopWord() {
            storage.upsertEntities(List.of(entity("w1", "Dances with Wolves", "FILM"))).join();

            List<Candidate> candidates =
                resolver.ngramPass("Who directed Dances with Wolves?", IntentAnalysis.unknown()).join();

            assertEquals(1, candidates.size());
            assertEquals("w1", candidates.get(0).entityId());
            assertEquals("Dances with Wolves", candidates.get(0).matchedText());
            assertEquals(1.0, candidates.get(0).matchQuality());
        }

        @Test
        @DisplayName("should resolve nothing for a query without mentions")
        void shouldResolveNothing() {
            GraphFixtures.seedCarterGraph(storage);

            assertTrue(resolver.resolve("what is it?", IntentAnalysis.unknown()).join().isEmpty());
        }
    }

    @Nested
    @DisplayName("mentions")
    class Mentions {

        @Test
        @DisplayName("should extract capitalized words and n-grams containing them")
        void shouldExtractNgrams() {
            List<String> mentions = resolver.extractMentions("Who is the CEO of Microsoft?");

            assertEquals(List.of("is the CEO", "the CEO", "the CEO of", "CEO", "CEO of", "CEO of Microsoft",
                "of Microsoft", "Microsoft"), mentions);
        }

        @Test
        @DisplayName("should only build n-grams from adjacent query words")
        void shouldKeepWordsAdjacent() {
            List<String> mentions = resolver.extractMentions("Who studied at University of the Arts?");

            assertTrue(mentions.contains("University of the"));
            assertTrue(mentions.contains("of the Arts"));
            assertFalse(mentions.contains("University of Arts"));
            assertFalse(mentions.contains("studied University"));
        }

        @Test
        @DisplayName("should treat domain words as mentions regardless of case")
        void shouldKeepDomainWords() {
            assertTrue(resolver.extractMentions("which university is best").contains("university"));
        }

        @Test
        @DisplayName("should restrict org-like mentions to organizations and names to people")
        void shouldChooseMentionFilter() {
            assertEquals(TypeFilter.of(EntityCategory.ORGANIZATION), resolver.mentionFilter("Carter Center"));
            assertEquals(TypeFilter.of(EntityCategory.PERSON), resolver.mentionFilter("Marie Curie"));
            assertEquals(TypeFilter.none(), resolver.mentionFilter("Mercury"));
            assertEquals(TypeFilter.none(), resolver.mentionFilter("CEO of"));
        }
    }

    @Test
    @DisplayName("should keep the best candidate per entity and cap the list")
    void shouldDedupeAndCap() {
        List<Candidate> raw = List.of(
            new Candidate("a", "Alpha", "ORG", "Alp", 0.6),
            new Candidate("a", "Alpha", "ORG", "Alpha", 1.0),
            new Candidate("b", "Beta", "ORG", "Beta", 0.8),
            new Candidate("c", "Gamma", "ORG", "Gamma", 0.8),
            new Candidate("d", "Delta", "ORG", "Delta Force", 0.8));

        List<Candidate> finished = QueryEntityResolver.finish(raw, 3);

        assertEquals(List.of("a", "d", "c"), finished.stream().map(Candidate::entityId).toList());
        assertEquals(1.0, finished.get(0).matchQuality());
    }
}
