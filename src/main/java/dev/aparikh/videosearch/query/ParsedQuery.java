package dev.aparikh.videosearch.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of splitting a raw query into search text and directives.
 *
 * @param original     the raw input
 * @param query        the remaining plain words joined by single spaces
 * @param sources      target sources from bangs, de-duplicated in first-seen order; empty means all enabled
 * @param exactPhrases quoted phrases a title must contain
 * @param exclusions   lowercase words that drop a result, in input order, repeats kept
 * @param performers   lowercase performer filters
 * @param hasBang      whether at least one bang resolved
 * @param invalidBang  the last {@code !token} that did not resolve, or null
 */
public record ParsedQuery(
        String original,
        String query,
        List<String> sources,
        List<String> exactPhrases,
        List<String> exclusions,
        List<String> performers,
        boolean hasBang,
        String invalidBang
) {
    public ParsedQuery {
        original = original == null ? "" : original;
        query = query == null ? "" : query;
        sources = List.copyOf(sources);
        exactPhrases = List.copyOf(exactPhrases);
        exclusions = List.copyOf(exclusions);
        performers = List.copyOf(performers);
    }

    public boolean hasPerformer() {
        return !performers.isEmpty();
    }

    /**
     * Text sent to the sources: the plain words followed by the exact phrases.
     */
    public String searchTerm() {
        List<String> parts = new ArrayList<>();
        if (!query.isBlank()) parts.add(query);
        parts.addAll(exactPhrases);
        return String.join(" ", parts).trim();
    }
}
