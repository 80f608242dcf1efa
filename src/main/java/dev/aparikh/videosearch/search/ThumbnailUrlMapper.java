package dev.aparikh.videosearch.search;

/**
 * Rewrites media URLs before results leave the service, e.g. to route them through an image proxy.
 */
@FunctionalInterface
public interface ThumbnailUrlMapper {

    ThumbnailUrlMapper IDENTITY = url -> url;

    /**
     * @param url a thumbnail or preview URL, possibly null
     * @return the URL to expose, or null when {@code url} is null
     */
    String map(String url);
}
