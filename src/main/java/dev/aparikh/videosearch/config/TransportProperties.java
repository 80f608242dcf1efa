package dev.aparikh.videosearch.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed configuration for outbound HTTP: timeouts, retry and circuit breaker, optional SOCKS5 hop.
 */
@Validated
@ConfigurationProperties(prefix = "videosearch.transport")
class TransportProperties {

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration responseTimeout = Duration.ofSeconds(15);

    @NotNull
    private DataSize maxBodySize = DataSize.ofMegabytes(5);

    private String userAgent;

    @Min(1)
    @Max(10)
    private int maxAttempts = 3;

    @NotNull
    private Duration initialBackoff = Duration.ofMillis(100);

    @NotNull
    private Duration maxBackoff = Duration.ofSeconds(2);

    @Positive
    private int failureThreshold = 5;

    @NotNull
    private Duration openStateWait = Duration.ofSeconds(30);

    @Valid
    private Proxy proxy = new Proxy();

    Duration getConnectTimeout() {
        return connectTimeout;
    }

    void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    Duration getResponseTimeout() {
        return responseTimeout;
    }

    void setResponseTimeout(Duration responseTimeout) {
        this.responseTimeout = responseTimeout;
    }

    DataSize getMaxBodySize() {
        return maxBodySize;
    }

    void setMaxBodySize(DataSize maxBodySize) {
        this.maxBodySize = maxBodySize;
    }

    String getUserAgent() {
        return userAgent;
    }

    void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    int getMaxAttempts() {
        return maxAttempts;
    }

    void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    Duration getInitialBackoff() {
        return initialBackoff;
    }

    void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    Duration getMaxBackoff() {
        return maxBackoff;
    }

    void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    int getFailureThreshold() {
        return failureThreshold;
    }

    void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    Duration getOpenStateWait() {
        return openStateWait;
    }

    void setOpenStateWait(Duration openStateWait) {
        this.openStateWait = openStateWait;
    }

    Proxy getProxy() {
        return proxy;
    }

    void setProxy(Proxy proxy) {
        this.proxy = proxy;
    }

    /**
     * SOCKS5 hop, e.g. a local Tor daemon.
     */
    static class Proxy {

        private boolean enabled = false;

        @NotBlank
        private String host = "127.0.0.1";

        @Min(1)
        @Max(65535)
        private int port = 9050;

        boolean isEnabled() {
            return enabled;
        }

        void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        String getHost() {
            return host;
        }

        void setHost(String host) {
            this.host = host;
        }

        int getPort() {
            return port;
        }

        void setPort(int port) {
            this.port = port;
        }
    }
}
