package br.edu.ifba.graphqa.storage;

import br.edu.ifba.graphqa.core.EntityCategory;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Set of entity type tags a store lookup is restricted to.
 *
 * <p>Tags are validated on construction and stores bind them as query
 * parameters. An empty filter matches every entity.</p>
 */
public final class TypeFilter {

    private static final Pattern TAG_PATTERN = Pattern.compile("[A-Z][A-Z0-9_]*");

    private static final TypeFilter NONE = new TypeFilter(Collections.emptySortedSet());

    private final Set<String> tags;

    private TypeFilter(Set<String> tags) {
        this.tags = tags;
    }

    public static TypeFilter none() {
        return NONE;
    }

    /**
     * Builds a filter from raw tags.
     *
     * @throws IllegalArgumentException if a tag is not an upper-case identifier
     */
    public static TypeFilter of(@NotNull Collection<String> rawTags) {
        if (rawTags.isEmpty()) {
            return NONE;
        }
        TreeSet<String> normalized = new TreeSet<>();
        for (String raw : rawTags) {
            if (raw == null) {
                throw new IllegalArgumentException("Type tag must not be null");
            }
            String tag = raw.trim().toUpperCase(Locale.ROOT);
            if (!TAG_PATTERN.matcher(tag).matches()) {
                throw new IllegalArgumentException("Invalid entity type tag: '" + raw + "'");
            }
            normalized.add(tag);
        }
        return new TypeFilter(Collections.unmodifiableSortedSet(normalized));
    }

    public static TypeFilter of(String... rawTags) {
        return of(Arrays.asList(rawTags));
    }

    public static TypeFilter of(EntityCategory... categories) {
        TreeSet<String> tags = new TreeSet<>();
        for (EntityCategory category : categories) {
            tags.addAll(category.typeTags());
        }
        return of(tags);
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }

    public boolean matches(@NotNull String entityType) {
        return tags.isEmpty() || tags.contains(entityType);
    }

    /**
     * Tags in a stable (sorted) order, suitable for binding to placeholders.
     */
    public List<String> tags() {
        return List.copyOf(tags);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeFilter other)) return false;
        return tags.equals(other.tags);
    }

    @Override
    public int hashCode() {
        return tags.hashCode();
    }

    @Override
    public String toString() {
        return tags.isEmpty() ? "TypeFilter[*]" : "TypeFilter" + tags;
    }
}
