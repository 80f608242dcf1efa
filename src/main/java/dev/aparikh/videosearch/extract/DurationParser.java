package dev.aparikh.videosearch.extract;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses duration text such as {@code 12:34}, {@code 1:02:03}, {@code 12 min} or raw seconds.
 */
public final class DurationParser {

    private static final Pattern MINUTES = Pattern.compile("(\\d+)\\s*min");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    public record ParsedDuration(String display, int seconds) {
        public static final ParsedDuration NONE = new ParsedDuration("", 0);
    }

    private DurationParser() {
    }

    public static ParsedDuration parse(String text) {
        String value = TextCleaner.clean(text).replace(" ", "");
        if (value.isEmpty()) return ParsedDuration.NONE;

        String[] parts = value.split(":");
        int seconds = switch (parts.length) {
            case 2 -> toInt(parts[0]) * 60 + toInt(parts[1]);
            case 3 -> toInt(parts[0]) * 3600 + toInt(parts[1]) * 60 + toInt(parts[2]);
            default -> -1;
        };
        if (seconds < 0) {
            Matcher minutes = MINUTES.matcher(value.toLowerCase(Locale.ROOT));
            if (minutes.find()) {
                seconds = toInt(minutes.group(1)) * 60;
            } else if (DIGITS.matcher(value).matches()) {
                seconds = toInt(value);
            } else {
                seconds = 0;
            }
        }
        return seconds > 0 ? new ParsedDuration(format(seconds), seconds) : ParsedDuration.NONE;
    }

    /**
     * Canonical display form: {@code H:MM:SS} when an hour or longer, otherwise {@code M:SS}.
     */
    public static String format(int seconds) {
        if (seconds <= 0) return "";
        int hours = seconds / 3600;
        int minutes = (seconds % 3600) / 60;
        int secs = seconds % 60;
        if (hours > 0) {
            return String.format(Locale.ROOT, "%d:%02d:%02d", hours, minutes, secs);
        }
        return String.format(Locale.ROOT, "%d:%02d", minutes, secs);
    }

    private static int toInt(String digits) {
        String cleaned = digits.replaceAll("\\D", "");
        if (cleaned.isEmpty()) return 0;
        try {
            return Integer.parseInt(cleaned);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
