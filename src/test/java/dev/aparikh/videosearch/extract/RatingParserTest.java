package dev.aparikh.videosearch.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RatingParserTest {

    @Test
    void percentagePassesThrough() {
        assertThat(RatingParser.parse("93%")).isEqualTo(93.0);
    }

    @Test
    void fractionIsScaled() {
        assertThat(RatingParser.parse("4.5/5")).isCloseTo(90.0, within(0.001));
        assertThat(RatingParser.parse("7/0")).isZero();
    }

    @Test
    void starsAndSmallNumbersUseFivePointScale() {
        assertThat(RatingParser.parse("4 stars")).isCloseTo(80.0, within(0.001));
        assertThat(RatingParser.parse("8")).isCloseTo(80.0, within(0.001));
    }

    @Test
    void largeNumbersAreCapped() {
        assertThat(RatingParser.parse("250")).isEqualTo(100.0);
    }

    @Test
    void garbageIsZero() {
        assertThat(RatingParser.parse("n/a")).isZero();
        assertThat(RatingParser.parse(null)).isZero();
    }
}
