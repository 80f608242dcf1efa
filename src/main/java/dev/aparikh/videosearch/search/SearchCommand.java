package dev.aparikh.videosearch.search;

import dev.aparikh.videosearch.query.ParsedQuery;

import java.util.List;

/**
 * A validated search ready for fan-out.
 *
 * @param parsed  the parsed query
 * @param term    the text sent to every source
 * @param page    1-based page
 * @param sources effective sources, in the order they were requested
 * @param dedupe  drop results whose normalized URL was already emitted in this request
 */
public record SearchCommand(
        ParsedQuery parsed,
        String term,
        int page,
        List<String> sources,
        boolean dedupe
) {
    public SearchCommand {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        sources = List.copyOf(sources);
    }
}
