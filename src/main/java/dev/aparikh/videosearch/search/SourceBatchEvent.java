package dev.aparikh.videosearch.search;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.aparikh.videosearch.model.Result;

import java.util.List;

/**
 * Results of one completed source, emitted as soon as that source finishes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceBatchEvent(
        String source,
        String sourceDisplay,
        boolean ok,
        String error,
        List<Result> results,
        int count,
        long elapsedMs
) implements SearchStreamEvent {

    public static final String EVENT_NAME = "result";

    public SourceBatchEvent {
        results = results == null ? List.of() : List.copyOf(results);
    }

    @Override
    @JsonIgnore
    public String eventName() {
        return EVENT_NAME;
    }
}
