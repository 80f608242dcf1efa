package dev.aparikh.videosearch.config;

import org.springframework.web.reactive.function.client.WebClient;

/**
 * Supplies the HTTP client used for outbound source requests.
 */
public interface TransportProvider {

    /**
     * The client to use; routed through the anonymizing hop when {@link #isAnonymized()} is true.
     */
    WebClient client();

    boolean isAnonymized();
}
