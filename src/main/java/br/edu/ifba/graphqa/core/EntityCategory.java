package br.edu.ifba.graphqa.core;

import org.jetbrains.annotations.NotNull;

import java.util.Set;

/**
 * Semantic answer categories and the literal graph type tags each one accepts.
 *
 * <p>These tag groups are the only type lists the resolver and the ranker ever
 * send to a store, so the set of tags reaching a query is closed.</p>
 */
public enum EntityCategory {
    PERSON(Set.of("PERSON", "PER")),
    ORGANIZATION(Set.of("ORGANIZATION", "ORG", "COMPANY", "GPE")),
    LOCATION(Set.of("LOCATION", "LOC", "GPE", "PLACE")),
    DATE(Set.of("DATE", "TIME")),
    NUMBER(Set.of("NUMBER", "CARDINAL", "QUANTITY", "MONEY", "PERCENT")),
    EVENT(Set.of("EVENT"));

    private final Set<String> typeTags;

    EntityCategory(Set<String> typeTags) {
        this.typeTags = typeTags;
    }

    @NotNull
    public Set<String> typeTags() {
        return typeTags;
    }

    public boolean accepts(@NotNull String entityType) {
        return typeTags.contains(entityType);
    }
}
