package dev.aparikh.videosearch.search;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Maps {@code https://cdn/x.jpg} to {@code <prefix>https%3A%2F%2Fcdn%2Fx.jpg}.
 */
public class PrefixThumbnailUrlMapper implements ThumbnailUrlMapper {

    private final String prefix;

    public PrefixThumbnailUrlMapper(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("proxy prefix must not be blank");
        }
        this.prefix = prefix.trim();
    }

    @Override
    public String map(String url) {
        if (url == null || url.isBlank()) return url;
        return prefix + URLEncoder.encode(url, StandardCharsets.UTF_8);
    }
}
