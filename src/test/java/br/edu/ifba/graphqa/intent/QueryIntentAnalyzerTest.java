package br.edu.ifba.graphqa.intent;

import br.edu.ifba.graphqa.core.Entity;
import br.edu.ifba.graphqa.core.ExpectedAnswerType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryIntentAnalyzerTest {

    private QueryIntentAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new QueryIntentAnalyzer();
    }

    @Nested
    @DisplayName("analyze")
    class Analyze {

        @Test
        @DisplayName("should classify a who-question as PERSON")
        void shouldClassifyPerson() {
            IntentAnalysis analysis = analyzer.analyze("Who founded the Carter Center?");

            assertEquals(ExpectedAnswerType.PERSON, analysis.expectedType());
            assertEquals(ExpectedAnswerType.PERSON, analysis.primaryType());
            assertEquals(0.6, analysis.confidence(), 1e-9);
            assertEquals(1.2, analysis.categoryScores().get("PERSON"), 1e-9);
            assertTrue(analysis.possibleTypes().isEmpty());
            assertEquals(2, analysis.matchedRules().size());
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
            "Where is the Carter Center headquartered?|LOCATION",
            "When did the war begin?|DATE",
            "How many employees does Microsoft have?|NUMBER",
            "Which company acquired GitHub?|ORGANIZATION",
            "What happened at the summit?|EVENT"
        })
        void shouldClassifySingleCategory(String query, ExpectedAnswerType expected) {
            assertEquals(expected, analyzer.analyze(query).expectedType());
        }

        @Test
        @DisplayName("should report MULTIPLE when two categories score closely")
        void shouldReportMultiple() {
            IntentAnalysis analysis = analyzer.analyze("Who is the CEO of which company?");

            assertEquals(ExpectedAnswerType.MULTIPLE, analysis.expectedType());
            assertEquals(ExpectedAnswerType.ORGANIZATION, analysis.primaryType());
            assertEquals(List.of(ExpectedAnswerType.PERSON), analysis.possibleTypes());
            assertEquals(0.7, analysis.confidence(), 1e-9);
        }

        @Test
        @DisplayName("should return UNKNOWN with zero confidence when nothing matches")
        void shouldReturnUnknown() {
            IntentAnalysis analysis = analyzer.analyze("Tell me about Mercury");

            assertTrue(analysis.isUnknown());
            assertEquals(ExpectedAnswerType.UNKNOWN, analysis.primaryType());
            assertEquals(0.0, analysis.confidence());
            assertTrue(analysis.matchedRules().isEmpty());
            assertEquals(6, analysis.categoryScores().size());
        }

        @Test
        @DisplayName("should match patterns case-insensitively")
        void shouldIgnoreCase() {
            assertEquals(ExpectedAnswerType.LOCATION, analyzer.analyze("WHERE IS PARIS").expectedType());
        }
    }

    @Nested
    @DisplayName("scoreAnswerRelevance")
    class Relevance {

        private Entity person(String name, Double centrality) {
            return Entity.builder().id("e1").canonicalName(name).entityType("PERSON")
                .centralityScore(centrality).build();
        }

        @Test
        @DisplayName("should give the compatible base to a type match")
        void shouldScoreCompatibleType() {
            double score = analyzer.scoreAnswerRelevance(person("Jimmy Carter", null),
                ExpectedAnswerType.PERSON, "Who founded the Carter Center?");

            assertEquals(0.7, score, 1e-9);
        }

        @Test
        @DisplayName("should halve the score of an entity named in the query")
        void shouldPenalizeEcho() {
            double score = analyzer.scoreAnswerRelevance(person("Jimmy Carter", null),
                ExpectedAnswerType.PERSON, "Who married Jimmy Carter?");

            assertEquals(0.35, score, 1e-9);
        }

        @Test
        @DisplayName("should score zero for an incompatible type without centrality")
        void shouldScoreIncompatibleType() {
            double score = analyzer.scoreAnswerRelevance(person("Jimmy Carter", null),
                ExpectedAnswerType.LOCATION, "Where is it?");

            assertEquals(0.0, score, 1e-9);
        }

        @Test
        @DisplayName("should cap the centrality bonus")
        void shouldCapCentralityBonus() {
            double undecided = analyzer.scoreAnswerRelevance(person("Ada", 0.05),
                ExpectedAnswerType.UNKNOWN, "tell me something");
            double small = analyzer.scoreAnswerRelevance(person("Ada", 0.01),
                ExpectedAnswerType.MULTIPLE, "tell me something");

            assertEquals(0.6, undecided, 1e-9);
            assertEquals(0.4, small, 1e-9);
        }

        @ParameterizedTest
        @ValueSource(doubles = {0.0, 0.001, 0.2, 1.0, 50.0})
        @DisplayName("should always stay within [0,1]")
        void shouldStayInRange(double centrality) {
            for (ExpectedAnswerType type : ExpectedAnswerType.values()) {
                double score = analyzer.scoreAnswerRelevance(person("Ada", centrality), type, "Who is Ada?");
                assertTrue(score >= 0.0 && score <= 1.0, type + " scored " + score);
            }
        }
    }

    @Test
    @DisplayName("should expose tag groups only for specific types")
    void shouldExposeCompatibleTypes() {
        assertEquals(Set.of("PERSON", "PER"), QueryIntentAnalyzer.compatibleEntityTypes(ExpectedAnswerType.PERSON));
        assertTrue(QueryIntentAnalyzer.compatibleEntityTypes(ExpectedAnswerType.MULTIPLE).isEmpty());
        assertFalse(QueryIntentAnalyzer.compatibleEntityTypes(ExpectedAnswerType.LOCATION).contains("PERSON"));
    }
}
