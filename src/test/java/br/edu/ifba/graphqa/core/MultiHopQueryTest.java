package br.edu.ifba.graphqa.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MultiHopQueryTest {

    @Test
    @DisplayName("should apply defaults when hops and limit are absent")
    void shouldApplyDefaults() {
        MultiHopQuery query = MultiHopQuery.of("  Who founded the Carter Center?  ", null, null);

        assertEquals("Who founded the Carter Center?", query.getQueryText());
        assertEquals(2, query.getMaxHops());
        assertEquals(10, query.getResultLimit());
    }

    @ParameterizedTest(name = "max_hops={0} -> {1}")
    @CsvSource({"-5, 1", "0, 1", "1, 1", "3, 3", "4, 3", "99, 3"})
    void shouldClampMaxHops(int requested, int expected) {
        assertEquals(expected, MultiHopQuery.of("query", requested, null).getMaxHops());
    }

    @ParameterizedTest(name = "result_limit={0} -> {1}")
    @CsvSource({"0, 1", "-1, 1", "50, 50", "100, 100", "101, 100"})
    void shouldClampResultLimit(int requested, int expected) {
        assertEquals(expected, MultiHopQuery.of("query", null, requested).getResultLimit());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\t\n"})
    @DisplayName("should reject blank query text")
    void shouldRejectBlankQuery(String text) {
        assertThrows(QueryValidationException.class, () -> MultiHopQuery.of(text, 2, 10));
    }
}
