package dev.aparikh.videosearch.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed configuration for search fan-out.
 */
@Validated
@ConfigurationProperties(prefix = SearchProperties.PREFIX)
class SearchProperties {

    static final String PREFIX = "videosearch.search";

    @NotNull
    private Duration sourceTimeout = Duration.ofSeconds(15);

    @NotNull
    private Duration requestDeadline = Duration.ofSeconds(20);

    @PositiveOrZero
    private int minDurationSeconds = 0;

    private List<String> enabledSources = new ArrayList<>(); // empty = every registered source

    Duration getSourceTimeout() {
        return sourceTimeout;
    }

    void setSourceTimeout(Duration sourceTimeout) {
        this.sourceTimeout = sourceTimeout;
    }

    Duration getRequestDeadline() {
        return requestDeadline;
    }

    void setRequestDeadline(Duration requestDeadline) {
        this.requestDeadline = requestDeadline;
    }

    int getMinDurationSeconds() {
        return minDurationSeconds;
    }

    void setMinDurationSeconds(int minDurationSeconds) {
        this.minDurationSeconds = minDurationSeconds;
    }

    List<String> getEnabledSources() {
        return enabledSources;
    }

    void setEnabledSources(List<String> enabledSources) {
        this.enabledSources = enabledSources;
    }

    SearchSettings toSettings() {
        return new SearchSettings(enabledSources, sourceTimeout, requestDeadline, minDurationSeconds);
    }
}
