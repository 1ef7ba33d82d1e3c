package br.edu.ifba.graphqa.core;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Answer type predicted for a query. Concrete types map onto an
 * {@link EntityCategory}; MULTIPLE and UNKNOWN accept any entity type.
 */
public enum ExpectedAnswerType {
    PERSON(EntityCategory.PERSON),
    ORGANIZATION(EntityCategory.ORGANIZATION),
    LOCATION(EntityCategory.LOCATION),
    DATE(EntityCategory.DATE),
    NUMBER(EntityCategory.NUMBER),
    EVENT(EntityCategory.EVENT),
    MULTIPLE(null),
    UNKNOWN(null);

    private final EntityCategory category;

    ExpectedAnswerType(@Nullable EntityCategory category) {
        this.category = category;
    }

    public Optional<EntityCategory> category() {
        return Optional.ofNullable(category);
    }

    public boolean isSpecific() {
        return category != null;
    }

    public static ExpectedAnswerType of(EntityCategory category) {
        return valueOf(category.name());
    }
}
