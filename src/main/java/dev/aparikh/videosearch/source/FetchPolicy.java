package dev.aparikh.videosearch.source;

import java.time.Duration;

/**
 * Retry, circuit breaker and header settings shared by all outbound source requests.
 */
public record FetchPolicy(
        int maxAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        int failureThreshold,
        Duration openStateWait,
        String userAgent
) {
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
                    + "Chrome/131.0.0.0 Safari/537.36";

    public FetchPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
        maxBackoff = maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0 ? initialBackoff : maxBackoff;
        openStateWait = openStateWait == null ? Duration.ofSeconds(30) : openStateWait;
        userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
    }

    public static FetchPolicy defaults() {
        return new FetchPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(2), 5, Duration.ofSeconds(30),
                DEFAULT_USER_AGENT);
    }
}
