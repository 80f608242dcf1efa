package dev.aparikh.videosearch.source;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SourceFetcherTest {

    private static final String URL = "https://tube.example.com/search?q=test";

    private final AtomicInteger calls = new AtomicInteger();
    private final List<ClientRequest> requests = new ArrayList<>();

    private WebClient respondingWith(HttpStatus... statuses) {
        return WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    int call = calls.getAndIncrement();
                    HttpStatus status = statuses[Math.min(call, statuses.length - 1)];
                    return Mono.just(ClientResponse.create(status).body("body-" + call).build());
                })
                .build();
    }

    @Test
    void returnsBodyAndSendsBrowserHeaders() {
        SourceFetcher fetcher = new SourceFetcher(Fixtures.FAST_POLICY);

        StepVerifier.create(fetcher.fetch(respondingWith(HttpStatus.OK), "tube", URL))
                .expectNext("body-0")
                .verifyComplete();

        HttpHeaders headers = requests.get(0).headers();
        assertThat(headers.getFirst(HttpHeaders.USER_AGENT)).isEqualTo(FetchPolicy.DEFAULT_USER_AGENT);
        assertThat(headers.getFirst(HttpHeaders.ACCEPT_LANGUAGE)).startsWith("en-US");
        assertThat(requests.get(0).url().toString()).isEqualTo(URL);
    }

    @Test
    void retriesServerErrorsThenFails() {
        SourceFetcher fetcher = new SourceFetcher(Fixtures.FAST_POLICY);

        StepVerifier.create(fetcher.fetch(respondingWith(HttpStatus.SERVICE_UNAVAILABLE), "tube", URL))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(SourceFetchException.class);
                    assertThat(error.getMessage()).isEqualTo("HTTP 503 after 3 attempts");
                    assertThat(((SourceFetchException) error).getSource()).isEqualTo("tube");
                })
                .verify(Duration.ofSeconds(5));

        assertThat(calls).hasValue(3);
    }

    @Test
    void recoversWhenRetrySucceeds() {
        SourceFetcher fetcher = new SourceFetcher(Fixtures.FAST_POLICY);

        StepVerifier.create(fetcher.fetch(respondingWith(HttpStatus.BAD_GATEWAY, HttpStatus.OK), "tube", URL))
                .expectNext("body-1")
                .verifyComplete();

        assertThat(calls).hasValue(2);
    }

    @Test
    void rateLimitIsRetried() {
        SourceFetcher fetcher = new SourceFetcher(Fixtures.FAST_POLICY);

        StepVerifier.create(fetcher.fetch(respondingWith(HttpStatus.TOO_MANY_REQUESTS, HttpStatus.OK), "tube", URL))
                .expectNext("body-1")
                .verifyComplete();
    }

    @Test
    void clientErrorsAreNotRetried() {
        SourceFetcher fetcher = new SourceFetcher(Fixtures.FAST_POLICY);

        StepVerifier.create(fetcher.fetch(respondingWith(HttpStatus.NOT_FOUND), "tube", URL))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(SourceFetchException.class)
                        .hasMessage("HTTP 404"))
                .verify(Duration.ofSeconds(5));

        assertThat(calls).hasValue(1);
    }

    @Test
    void circuitOpensAfterRepeatedFailures() {
        FetchPolicy policy = new FetchPolicy(1, Duration.ZERO, Duration.ZERO, 2, Duration.ofMinutes(5), null);
        SourceFetcher fetcher = new SourceFetcher(policy);
        WebClient client = respondingWith(HttpStatus.INTERNAL_SERVER_ERROR);

        for (int i = 0; i < 2; i++) {
            StepVerifier.create(fetcher.fetch(client, "flaky", URL))
                    .expectError(SourceFetchException.class)
                    .verify(Duration.ofSeconds(5));
        }
        assertThat(fetcher.circuitState("flaky")).isEqualTo(CircuitBreaker.State.OPEN);

        StepVerifier.create(fetcher.fetch(client, "flaky", URL))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(SourceFetchException.class)
                        .hasMessage("circuit open"))
                .verify(Duration.ofSeconds(5));

        assertThat(calls).hasValue(2);
        assertThat(fetcher.circuitState("other")).isEqualTo(CircuitBreaker.State.CLOSED);
    }
}
