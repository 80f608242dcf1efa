package dev.aparikh.videosearch.search;

/**
 * An event of a streamed search.
 */
public interface SearchStreamEvent {

    /**
     * SSE event name.
     */
    String eventName();
}
