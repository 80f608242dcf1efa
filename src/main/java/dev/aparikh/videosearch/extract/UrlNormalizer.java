package dev.aparikh.videosearch.extract;

import java.util.Locale;

/**
 * Turns the href and src flavours found in scraped markup into absolute URLs.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    /**
     * Resolves {@code href} against {@code baseUrl}.
     * Absolute URLs pass through, protocol-relative ones are upgraded to https,
     * root-relative and relative paths are joined to the base URL.
     *
     * @return the absolute URL, or an empty string when href is blank
     */
    public static String absolute(String href, String baseUrl) {
        if (href == null) return "";
        String value = href.trim();
        if (value.isEmpty()) return "";
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return value;
        }
        if (value.startsWith("//")) {
            return "https:" + value;
        }
        String base = stripTrailingSlash(baseUrl == null ? "" : baseUrl.trim());
        if (value.startsWith("/")) {
            return base + value;
        }
        return base + "/" + value;
    }

    /**
     * Media URLs only get protocol-relative upgrades and root-relative joins; anything else is returned as is.
     */
    public static String media(String src, String baseUrl) {
        if (src == null || src.isBlank()) return "";
        String value = src.trim();
        if (value.startsWith("//")) return "https:" + value;
        if (value.startsWith("/")) return stripTrailingSlash(baseUrl == null ? "" : baseUrl.trim()) + value;
        return value;
    }

    /**
     * Key used for cross-source deduplication: lowercase, without scheme, {@code www.},
     * query string, fragment and trailing slash.
     */
    public static String dedupeKey(String url) {
        if (url == null || url.isBlank()) return "";
        return url.trim().toLowerCase(Locale.ROOT)
                .replaceFirst("^https?://", "")
                .replaceFirst("^www\\.", "")
                .replaceAll("#.*$", "")
                .replaceAll("\\?.*$", "")
                .replaceAll("/+$", "");
    }

    private static String stripTrailingSlash(String base) {
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
