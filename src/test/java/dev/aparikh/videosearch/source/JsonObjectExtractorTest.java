package dev.aparikh.videosearch.source;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonObjectExtractorTest {

    @Test
    void extractsObjectAfterMarkerIgnoringTrailingScript() {
        String html = "<script>window.initials={\"a\":{\"b\":1}};window.x={\"c\":2};</script>";

        assertThat(JsonObjectExtractor.extractAfter(html, "window.initials="))
                .contains("{\"a\":{\"b\":1}}");
    }

    @Test
    void bracesInsideStringsDoNotCloseTheObject() {
        String html = "window.initials={\"title\":\"a } b { c\",\"n\":{\"q\":\"}\"}} trailing }}}";

        assertThat(JsonObjectExtractor.extractAfter(html, "window.initials="))
                .contains("{\"title\":\"a } b { c\",\"n\":{\"q\":\"}\"}}");
    }

    @Test
    void escapedQuotesStayInsideTheString() {
        String text = "{\"t\":\"say \\\"}\\\" now\"} rest";

        assertThat(JsonObjectExtractor.extract(text, 0)).contains("{\"t\":\"say \\\"}\\\" now\"}");
    }

    @Test
    void missingMarkerOrUnclosedObjectIsEmpty() {
        assertThat(JsonObjectExtractor.extractAfter("<html></html>", "window.initials=")).isEmpty();
        assertThat(JsonObjectExtractor.extractAfter("window.initials={\"a\":1", "window.initials=")).isEmpty();
        assertThat(JsonObjectExtractor.extractAfter(null, "window.initials=")).isEmpty();
    }
}
