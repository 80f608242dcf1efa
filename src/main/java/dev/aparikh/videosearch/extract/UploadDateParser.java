package dev.aparikh.videosearch.extract;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Reads upload timestamps as sources publish them. Values without an offset are taken as UTC.
 */
public final class UploadDateParser {

    private static final DateTimeFormatter SPACED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private UploadDateParser() {
    }

    /**
     * Parses ISO-8601 instants and offsets, {@code yyyy-MM-dd HH:mm:ss} and plain dates.
     *
     * @return the instant, or null when the text is blank or unrecognized
     */
    public static Instant parse(String text) {
        String value = TextCleaner.clean(text);
        if (value.isEmpty()) return null;
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ignored) {
            // not an offset timestamp
        }
        try {
            return LocalDateTime.parse(value, SPACED).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // not the spaced form
        }
        try {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Converts epoch seconds, treating zero and negative values as unknown.
     */
    public static Instant fromEpochSeconds(long seconds) {
        return seconds > 0 ? Instant.ofEpochSecond(seconds) : null;
    }
}
