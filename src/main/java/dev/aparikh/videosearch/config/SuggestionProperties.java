package dev.aparikh.videosearch.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Autocomplete tables supplied by configuration.
 */
@Validated
@ConfigurationProperties(prefix = SuggestionProperties.PREFIX)
class SuggestionProperties {

    static final String PREFIX = "videosearch.suggestions";

    private List<String> customTerms = new ArrayList<>();

    private List<String> performers = new ArrayList<>();

    @Min(1)
    @Max(50)
    private int maxResults = 10;

    List<String> getCustomTerms() {
        return customTerms;
    }

    void setCustomTerms(List<String> customTerms) {
        this.customTerms = customTerms;
    }

    List<String> getPerformers() {
        return performers;
    }

    void setPerformers(List<String> performers) {
        this.performers = performers;
    }

    int getMaxResults() {
        return maxResults;
    }

    void setMaxResults(int maxResults) {
        this.maxResults = maxResults;
    }
}
