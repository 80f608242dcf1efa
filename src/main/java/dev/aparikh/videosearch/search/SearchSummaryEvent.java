package dev.aparikh.videosearch.search;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Final event of a streamed search.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchSummaryEvent(
        String query,
        String searchQuery,
        int page,
        List<String> sourcesUsed,
        List<FailedSource> failedSources,
        int total,
        long elapsedMs,
        boolean hasBang,
        List<String> bangSources,
        String invalidBang,
        List<String> relatedSearches,
        boolean anonymized
) implements SearchStreamEvent {

    public static final String EVENT_NAME = "done";

    public SearchSummaryEvent {
        sourcesUsed = List.copyOf(sourcesUsed);
        failedSources = List.copyOf(failedSources);
        bangSources = List.copyOf(bangSources);
        relatedSearches = relatedSearches == null ? List.of() : List.copyOf(relatedSearches);
    }

    @Override
    @JsonIgnore
    public String eventName() {
        return EVENT_NAME;
    }
}
