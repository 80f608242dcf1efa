package dev.aparikh.videosearch.source;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;

/**
 * Outbound GET pipeline used by every adapter: browser-like headers, bounded exponential
 * retry on 5xx/429 and transport errors, and one circuit breaker per source.
 */
public class SourceFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(SourceFetcher.class);

    static final int DEBUG_BODY_LIMIT = 2000;

    private final FetchPolicy policy;
    private final CircuitBreakerRegistry breakers;

    public SourceFetcher(FetchPolicy policy) {
        this.policy = policy;
        this.breakers = CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(policy.failureThreshold())
                .minimumNumberOfCalls(policy.failureThreshold())
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(policy.openStateWait())
                .permittedNumberOfCallsInHalfOpenState(1)
                .build());
    }

    /**
     * Fetches {@code url} on behalf of {@code source} and emits the response body.
     *
     * @throws SourceFetchException (as an error signal) on non-2xx after retries, transport
     *                              failure or an open circuit
     */
    public Mono<String> fetch(WebClient client, String source, String url) {
        CircuitBreaker breaker = breakers.circuitBreaker(source);
        return Mono.defer(() -> exchange(client, source, url))
                .retryWhen(Retry.backoff(policy.maxAttempts() - 1L, policy.initialBackoff())
                        .maxBackoff(policy.maxBackoff())
                        .filter(SourceFetcher::isRetryable)
                        .doBeforeRetry(signal -> LOG.debug("Retrying {} (attempt {}): {}",
                                source, signal.totalRetries() + 2, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> new SourceFetchException(source,
                                signal.failure().getMessage() + " after " + policy.maxAttempts() + " attempts",
                                signal.failure())))
                .onErrorMap(e -> !(e instanceof SourceFetchException),
                        e -> new SourceFetchException(source, "request failed: " + e.getMessage(), e))
                .transformDeferred(CircuitBreakerOperator.of(breaker))
                .onErrorMap(CallNotPermittedException.class,
                        e -> new SourceFetchException(source, "circuit open", e))
                .doOnNext(body -> logBody(source, url, body));
    }

    public CircuitBreaker.State circuitState(String source) {
        return breakers.circuitBreaker(source).getState();
    }

    private Mono<String> exchange(WebClient client, String source, String url) {
        return client.get()
                .uri(URI.create(url))
                .headers(this::browserHeaders)
                .exchangeToMono(response -> handle(source, response));
    }

    private Mono<String> handle(String source, ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        if (status.is5xxServerError() || status.value() == 429) {
            return response.releaseBody().then(Mono.error(new RetryableStatusException(source, status.value())));
        }
        if (!status.is2xxSuccessful()) {
            return response.releaseBody().then(Mono.error(new SourceFetchException(source, "HTTP " + status.value())));
        }
        return response.bodyToMono(String.class).defaultIfEmpty("");
    }

    private void browserHeaders(HttpHeaders headers) {
        headers.set(HttpHeaders.USER_AGENT, policy.userAgent());
        headers.set(HttpHeaders.ACCEPT,
                "text/html,application/xhtml+xml,application/xml;q=0.9,application/json;q=0.9,*/*;q=0.8");
        headers.set(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9");
        headers.set("Upgrade-Insecure-Requests", "1");
        headers.set("Sec-Fetch-Dest", "document");
        headers.set("Sec-Fetch-Mode", "navigate");
        headers.set("Sec-Fetch-Site", "none");
        headers.set("Sec-Fetch-User", "?1");
    }

    private static boolean isRetryable(Throwable error) {
        return error instanceof RetryableStatusException || error instanceof WebClientRequestException;
    }

    private static void logBody(String source, String url, String body) {
        if (!LOG.isDebugEnabled()) return;
        String excerpt = body.length() > DEBUG_BODY_LIMIT ? body.substring(0, DEBUG_BODY_LIMIT) : body;
        LOG.debug("{} response from {} ({} chars): {}", source, url, body.length(), excerpt);
    }

    static final class RetryableStatusException extends SourceFetchException {
        RetryableStatusException(String source, int status) {
            super(source, "HTTP " + status);
        }
    }
}
