package dev.aparikh.videosearch.extract;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class UploadDateParserTest {

    @Test
    void spacedTimestampIsUtc() {
        assertThat(UploadDateParser.parse("2024-05-01 10:00:00")).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void offsetTimestampIsConverted() {
        assertThat(UploadDateParser.parse("2024-05-01T12:00:00+02:00"))
                .isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void plainDateIsStartOfDay() {
        assertThat(UploadDateParser.parse("2023-12-31")).isEqualTo(Instant.parse("2023-12-31T00:00:00Z"));
    }

    @Test
    void unknownValuesAreNull() {
        assertThat(UploadDateParser.parse("yesterday")).isNull();
        assertThat(UploadDateParser.parse(null)).isNull();
        assertThat(UploadDateParser.fromEpochSeconds(0)).isNull();
        assertThat(UploadDateParser.fromEpochSeconds(1_700_000_000L)).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
    }
}
