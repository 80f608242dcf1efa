package dev.aparikh.videosearch.suggest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Scores candidates against typed input.
 * <p>
 * A prefix match scores {@code 300 - length}, a match at the start of any later word
 * {@code 200 - length}, a plain substring {@code 100 - length}; anything else is excluded.
 * Lengths are capped at 99 so the tiers never overlap, and shorter candidates win inside a tier.
 */
public final class SuggestionRanker {

    static final int PREFIX = 300;
    static final int WORD_PREFIX = 200;
    static final int CONTAINS = 100;
    private static final int MAX_PENALTY = 99;

    static final int SHARED_WORD = 20;
    static final int SHARED_WORD_PREFIX = 10;
    static final int SHARED_WORD_PART = 5;
    static final int PHRASE_OVERLAP = 15;
    static final int MIN_RELATED_WORD = 3;

    private SuggestionRanker() {
    }

    public record Scored(String value, int score) {
    }

    /**
     * @return 0 when {@code candidate} does not match {@code input}
     */
    public static int score(String candidate, String input) {
        if (candidate == null || input == null || input.isEmpty()) return 0;
        String lower = candidate.toLowerCase(Locale.ROOT);
        String needle = input.toLowerCase(Locale.ROOT);
        int penalty = Math.min(candidate.length(), MAX_PENALTY);

        if (lower.startsWith(needle)) {
            return PREFIX - penalty;
        }
        for (String word : lower.split("\\s+")) {
            if (word.startsWith(needle)) {
                return WORD_PREFIX - penalty;
            }
        }
        if (lower.contains(needle)) {
            return CONTAINS - penalty;
        }
        return 0;
    }

    /**
     * Matching candidates by descending score, ties kept in candidate order, at most {@code max}.
     */
    public static List<Scored> rank(List<String> candidates, String input, int max) {
        List<Scored> matches = new ArrayList<>();
        if (max <= 0) return matches;
        for (String candidate : candidates) {
            int score = score(candidate, input);
            if (score > 0) {
                matches.add(new Scored(candidate, score));
            }
        }
        matches.sort(Comparator.comparingInt(Scored::score).reversed());
        return matches.size() > max ? new ArrayList<>(matches.subList(0, max)) : matches;
    }

    /**
     * Word overlap between a candidate and a whole query. Each query word of at least three
     * characters adds 20 per equal candidate word, 10 per word that is a prefix of the other and
     * 5 per word contained in the other. Either phrase containing the other adds 15.
     *
     * @return 0 when the two share nothing
     */
    public static int relatedness(String candidate, String query) {
        if (candidate == null || query == null) return 0;
        String lower = candidate.toLowerCase(Locale.ROOT).trim();
        String phrase = query.toLowerCase(Locale.ROOT).trim();
        if (lower.isEmpty() || phrase.isEmpty()) return 0;

        int score = 0;
        String[] candidateWords = lower.split("\\s+");
        for (String queryWord : phrase.split("\\s+")) {
            if (queryWord.length() < MIN_RELATED_WORD) continue;
            for (String word : candidateWords) {
                if (word.equals(queryWord)) {
                    score += SHARED_WORD;
                } else if (word.startsWith(queryWord) || queryWord.startsWith(word)) {
                    score += SHARED_WORD_PREFIX;
                } else if (word.contains(queryWord) || queryWord.contains(word)) {
                    score += SHARED_WORD_PART;
                }
            }
        }
        if (lower.contains(phrase) || phrase.contains(lower)) {
            score += PHRASE_OVERLAP;
        }
        return score;
    }
}
