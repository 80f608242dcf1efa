package dev.aparikh.videosearch.suggest;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record TermSuggestion(
        String term,
        @JsonIgnore int score
) {
}
