package dev.aparikh.videosearch.suggest;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SuggestionRankerTest {

    @Test
    void prefixBeatsWordPrefixBeatsSubstring() {
        assertThat(SuggestionRanker.score("pornhub", "po")).isEqualTo(300 - 7);
        assertThat(SuggestionRanker.score("big tits", "ti")).isEqualTo(200 - 8);
        assertThat(SuggestionRanker.score("lesbian", "bi")).isEqualTo(100 - 7);
        assertThat(SuggestionRanker.score("lesbian", "zz")).isZero();
    }

    @Test
    void matchingIgnoresCase() {
        assertThat(SuggestionRanker.score("PornHub", "pOR")).isEqualTo(300 - 7);
    }

    @Test
    void emptyInputMatchesNothing() {
        assertThat(SuggestionRanker.score("anything", "")).isZero();
        assertThat(SuggestionRanker.score(null, "a")).isZero();
    }

    @Test
    void longCandidatesStayInsideTheirTier() {
        String longName = "a".repeat(150);

        assertThat(SuggestionRanker.score(longName, "a")).isEqualTo(SuggestionRanker.PREFIX - 99);
        assertThat(SuggestionRanker.score(longName, "a")).isGreaterThan(SuggestionRanker.score("x ab", "a"));
    }

    @Test
    void shorterCandidateWinsWithinTier() {
        List<SuggestionRanker.Scored> ranked = SuggestionRanker.rank(List.of("porntube", "pornhub"), "po", 10);

        assertThat(ranked).extracting(SuggestionRanker.Scored::value).containsExactly("pornhub", "porntube");
    }

    @Test
    void equalScoresKeepCandidateOrder() {
        List<SuggestionRanker.Scored> ranked = SuggestionRanker.rank(List.of("abcx", "abcy", "abcz"), "ab", 10);

        assertThat(ranked).extracting(SuggestionRanker.Scored::value).containsExactly("abcx", "abcy", "abcz");
    }

    @Test
    void rankDropsNonMatchesAndTruncates() {
        List<SuggestionRanker.Scored> ranked = SuggestionRanker.rank(
                List.of("blonde", "big ass", "ebony", "bbw", "lesbian"), "b", 2);

        assertThat(ranked).extracting(SuggestionRanker.Scored::value).containsExactly("bbw", "blonde");
        assertThat(SuggestionRanker.rank(List.of("blonde"), "b", 0)).isEmpty();
    }

    @Test
    void relatednessWeighsSharedWords() {
        assertThat(SuggestionRanker.relatedness("anal creampie", "anal")).isEqualTo(20 + 15);
        assertThat(SuggestionRanker.relatedness("redheads", "redhead teen")).isEqualTo(10);
        assertThat(SuggestionRanker.relatedness("hairy", "air")).isEqualTo(5 + 15);
        assertThat(SuggestionRanker.relatedness("blonde", "big ass")).isZero();
    }

    @Test
    void relatednessIgnoresShortQueryWords() {
        assertThat(SuggestionRanker.relatedness("pov", "on")).isZero();
        assertThat(SuggestionRanker.relatedness(null, "anal")).isZero();
    }
}
