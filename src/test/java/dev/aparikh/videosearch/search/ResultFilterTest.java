package dev.aparikh.videosearch.search;

import dev.aparikh.videosearch.model.Result;
import dev.aparikh.videosearch.query.ParsedQuery;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultFilterTest {

    private static ParsedQuery query(List<String> phrases, List<String> exclusions, List<String> performers) {
        return new ParsedQuery("raw", "q", List.of(), phrases, exclusions, performers, false, null);
    }

    private static Result result(String title, int seconds, List<String> tags, String performer) {
        return Result.builder()
                .title(title)
                .url("https://example.com/" + title.hashCode())
                .duration(seconds > 0 ? "x" : null, seconds)
                .tags(tags)
                .performer(performer)
                .build()
                .orElseThrow();
    }

    @Test
    void passesEverythingWithoutOperators() {
        ResultFilter filter = ResultFilter.of(query(List.of(), List.of(), List.of()), 0);

        assertThat(filter.test(result("Anything", 5, List.of(), null))).isTrue();
    }

    @Test
    void dropsShortResultsButKeepsUnknownDurations() {
        ResultFilter filter = ResultFilter.of(query(List.of(), List.of(), List.of()), 60);

        assertThat(filter.test(result("Short", 30, List.of(), null))).isFalse();
        assertThat(filter.test(result("Long", 600, List.of(), null))).isTrue();
        assertThat(filter.test(result("Unknown", 0, List.of(), null))).isTrue();
    }

    @Test
    void exclusionMatchesTitleOrTag() {
        ResultFilter filter = ResultFilter.of(query(List.of(), List.of("dog"), List.of()), 0);

        assertThat(filter.test(result("Big Dog run", 0, List.of(), null))).isFalse();
        assertThat(filter.test(result("Cat nap", 0, List.of("doggy"), null))).isFalse();
        assertThat(filter.test(result("Cat nap", 0, List.of("cats"), null))).isTrue();
    }

    @Test
    void everyPhraseMustAppearInTitle() {
        ResultFilter filter = ResultFilter.of(query(List.of("big cat", "lake"), List.of(), List.of()), 0);

        assertThat(filter.test(result("A BIG CAT at the lake", 0, List.of(), null))).isTrue();
        assertThat(filter.test(result("A big cat in town", 0, List.of(), null))).isFalse();
    }

    @Test
    void performerMatchesIgnoringSeparators() {
        ResultFilter filter = ResultFilter.of(query(List.of(), List.of(), List.of("jane_doe")), 0);

        assertThat(filter.test(result("Video", 0, List.of(), "Jane Doe"))).isTrue();
        assertThat(filter.test(result("Jane-Doe at home", 0, List.of(), null))).isTrue();
        assertThat(filter.test(result("Clip", 0, List.of("jane doe"), null))).isTrue();
        assertThat(filter.test(result("Someone else", 0, List.of(), "John"))).isFalse();
    }

    @Test
    void anyOfSeveralPerformersIsEnough() {
        ResultFilter filter = ResultFilter.of(query(List.of(), List.of(), List.of("jane", "mia")), 0);

        assertThat(filter.test(result("Mia outdoors", 0, List.of(), null))).isTrue();
    }
}
