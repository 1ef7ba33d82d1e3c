package br.edu.ifba.graphqa.storage;

import br.edu.ifba.graphqa.core.EntityCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TypeFilterTest {

    @Test
    @DisplayName("empty filter should accept every type")
    void emptyFilterAcceptsAll() {
        assertTrue(TypeFilter.none().isEmpty());
        assertTrue(TypeFilter.none().matches("ANYTHING"));
        assertTrue(TypeFilter.of(List.of()).isEmpty());
    }

    @Test
    @DisplayName("should normalize and sort tags")
    void shouldNormalizeTags() {
        TypeFilter filter = TypeFilter.of(" person ", "ORG");

        assertEquals(List.of("ORG", "PERSON"), filter.tags());
        assertTrue(filter.matches("PERSON"));
        assertFalse(filter.matches("LOCATION"));
    }

    @Test
    @DisplayName("should expand categories into their tag groups")
    void shouldExpandCategories() {
        TypeFilter filter = TypeFilter.of(EntityCategory.ORGANIZATION);

        assertEquals(List.of("COMPANY", "GPE", "ORG", "ORGANIZATION"), filter.tags());
    }

    @ParameterizedTest
    @ValueSource(strings = {"PERSON') OR 1=1 --", "1ABC", "A-B", "", "per son"})
    @DisplayName("should reject tags that are not upper-case identifiers")
    void shouldRejectMalformedTags(String tag) {
        assertThrows(IllegalArgumentException.class, () -> TypeFilter.of(tag));
    }
}
