package dev.aparikh.videosearch.search;

import java.util.List;

/**
 * Suggests follow-up searches for a search term.
 */
@FunctionalInterface
public interface RelatedSearches {

    RelatedSearches NONE = term -> List.of();

    List<String> related(String term);
}
