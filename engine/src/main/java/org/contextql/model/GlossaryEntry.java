package org.contextql.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A business term definition.
 *
 * @param term           The term
 * @param definition     Its definition
 * @param synonyms       Alternative spellings or names
 * @param relatedColumns {@code dataset.column} references the term maps to
 * @param examples       Free-text usage examples (may be null)
 */
public record GlossaryEntry(
        String term,
        String definition,
        List<String> synonyms,
        List<String> relatedColumns,
        String examples) implements ContextElement {

    public GlossaryEntry {
        Objects.requireNonNull(term, "Glossary term cannot be null");
        synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
        relatedColumns = relatedColumns == null ? List.of() : List.copyOf(relatedColumns);
    }

    /**
     * Case-insensitive substring match against the term and its synonyms.
     */
    public boolean matches(String search) {
        String needle = search.toLowerCase(Locale.ROOT).trim();
        if (term.toLowerCase(Locale.ROOT).contains(needle)) {
            return true;
        }
        return synonyms.stream().anyMatch(s -> s.toLowerCase(Locale.ROOT).contains(needle));
    }

    @Override
    public String elementId() {
        return term;
    }

    @Override
    public Kind kind() {
        return Kind.GLOSSARY;
    }
}
