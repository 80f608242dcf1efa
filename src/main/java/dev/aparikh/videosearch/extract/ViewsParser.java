package dev.aparikh.videosearch.extract;

import java.util.Locale;

/**
 * Parses view counters like {@code 1.2M}, {@code 500K views} or {@code 12,345}.
 */
public final class ViewsParser {

    public record ParsedViews(String display, long count) {
        public static final ParsedViews NONE = new ParsedViews("", 0);
    }

    private ViewsParser() {
    }

    public static ParsedViews parse(String text) {
        String original = TextCleaner.clean(text);
        if (original.isEmpty()) return ParsedViews.NONE;

        String value = original.toUpperCase(Locale.ROOT);
        if (value.endsWith("VIEWS")) {
            value = value.substring(0, value.length() - "VIEWS".length()).trim();
        }

        long multiplier = 1;
        if (value.endsWith("K")) {
            multiplier = 1_000L;
        } else if (value.endsWith("M")) {
            multiplier = 1_000_000L;
        } else if (value.endsWith("B")) {
            multiplier = 1_000_000_000L;
        }
        if (multiplier > 1) {
            value = value.substring(0, value.length() - 1);
        }
        value = value.replace(",", "").replace(" ", "");

        try {
            return new ParsedViews(original, (long) (Double.parseDouble(value) * multiplier));
        } catch (NumberFormatException e) {
            return new ParsedViews(original, 0);
        }
    }

    /**
     * Compact display for a raw counter, e.g. {@code 1.2M} or {@code 950}.
     */
    public static String format(long views) {
        if (views >= 1_000_000) {
            return String.format(Locale.ROOT, "%.1fM", views / 1_000_000.0);
        }
        if (views >= 1_000) {
            return String.format(Locale.ROOT, "%.1fK", views / 1_000.0);
        }
        return Long.toString(Math.max(0, views));
    }
}
