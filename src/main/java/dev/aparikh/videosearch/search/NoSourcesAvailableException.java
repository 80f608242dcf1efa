package dev.aparikh.videosearch.search;

/**
 * None of the requested sources is registered and enabled.
 */
public class NoSourcesAvailableException extends RuntimeException {

    public NoSourcesAvailableException(String message) {
        super(message);
    }
}
