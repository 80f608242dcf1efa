package dev.aparikh.videosearch.source;

import java.util.Optional;

/**
 * Pulls a JSON object literal that is embedded in an HTML page, e.g. after {@code window.initials=}.
 * Braces are counted outside string literals only, so braces inside titles do not end the object early.
 */
public final class JsonObjectExtractor {

    private JsonObjectExtractor() {
    }

    /**
     * Finds {@code marker} in {@code html} and returns the balanced object that follows it.
     *
     * @return the object text, or empty when the marker is missing or the object never closes
     */
    public static Optional<String> extractAfter(String html, String marker) {
        if (html == null || marker == null) return Optional.empty();
        int index = html.indexOf(marker);
        if (index < 0) return Optional.empty();
        return extract(html, index + marker.length());
    }

    /**
     * Returns the balanced object starting at the first {@code '{'} at or after {@code from}.
     */
    public static Optional<String> extract(String text, int from) {
        int start = text.indexOf('{', from);
        if (start < 0) return Optional.empty();

        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                escaped = false;
                continue;
            }
            if (c == '\\' && inString) {
                escaped = true;
                continue;
            }
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (inString) continue;

            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return Optional.of(text.substring(start, i + 1));
                }
            }
        }
        return Optional.empty();
    }
}
