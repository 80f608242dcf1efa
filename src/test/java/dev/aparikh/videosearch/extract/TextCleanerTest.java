package dev.aparikh.videosearch.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextCleanerTest {

    @Test
    void collapsesWhitespaceAndNonBreakingSpaces() {
        assertThat(TextCleaner.clean("  Hot\u00A0 video \n\t title ")).isEqualTo("Hot video title");
    }

    @Test
    void nullBecomesEmpty() {
        assertThat(TextCleaner.clean(null)).isEmpty();
    }
}
