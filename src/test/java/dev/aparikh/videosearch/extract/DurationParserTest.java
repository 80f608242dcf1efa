package dev.aparikh.videosearch.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DurationParserTest {

    @Test
    void parsesMinutesAndSeconds() {
        DurationParser.ParsedDuration duration = DurationParser.parse("12:34");

        assertThat(duration.seconds()).isEqualTo(754);
        assertThat(duration.display()).isEqualTo("12:34");
    }

    @Test
    void parsesHoursMinutesAndSeconds() {
        DurationParser.ParsedDuration duration = DurationParser.parse(" 1:02:03 ");

        assertThat(duration.seconds()).isEqualTo(3723);
        assertThat(duration.display()).isEqualTo("1:02:03");
    }

    @Test
    void parsesMinuteSuffix() {
        assertThat(DurationParser.parse("12 min").seconds()).isEqualTo(720);
        assertThat(DurationParser.parse("8min").display()).isEqualTo("8:00");
    }

    @Test
    void parsesRawSeconds() {
        assertThat(DurationParser.parse("95").display()).isEqualTo("1:35");
    }

    @Test
    void unparseableTextIsNone() {
        assertThat(DurationParser.parse("HD")).isEqualTo(DurationParser.ParsedDuration.NONE);
        assertThat(DurationParser.parse(null)).isEqualTo(DurationParser.ParsedDuration.NONE);
        assertThat(DurationParser.parse("0:00")).isEqualTo(DurationParser.ParsedDuration.NONE);
    }

    @Test
    void formatPadsSecondsAndMinutes() {
        assertThat(DurationParser.format(61)).isEqualTo("1:01");
        assertThat(DurationParser.format(3605)).isEqualTo("1:00:05");
        assertThat(DurationParser.format(0)).isEmpty();
    }
}
