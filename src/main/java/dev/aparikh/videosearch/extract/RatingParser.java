package dev.aparikh.videosearch.extract;

import java.util.Locale;

/**
 * Normalizes rating text onto a 0-100 scale.
 * Accepts percentages ({@code 93%}), fractions ({@code 4.5/5}), star ratings and bare numbers.
 */
public final class RatingParser {

    private RatingParser() {
    }

    public static double parse(String text) {
        String value = TextCleaner.clean(text);
        if (value.isEmpty()) return 0;

        if (value.endsWith("%")) {
            return toDouble(value.substring(0, value.length() - 1));
        }

        if (value.contains("/")) {
            String[] parts = value.split("/");
            if (parts.length == 2) {
                double score = toDouble(parts[0]);
                double max = toDouble(parts[1]);
                return max > 0 ? (score / max) * 100 : 0;
            }
            return 0;
        }

        value = value.toLowerCase(Locale.ROOT).replace("stars", "").replace("star", "").trim();
        double score = toDouble(value);
        if (score <= 0) return 0;
        if (score <= 5) return (score / 5) * 100;
        if (score <= 10) return score * 10;
        return Math.min(score, 100);
    }

    private static double toDouble(String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
