package dev.aparikh.videosearch.search;

import dev.aparikh.videosearch.model.Result;
import dev.aparikh.videosearch.query.ParsedQuery;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Post-filters derived from the query operators and the minimum duration setting.
 */
final class ResultFilter implements Predicate<Result> {

    private final int minDurationSeconds;
    private final List<String> exclusions;
    private final List<String> exactPhrases;
    private final List<String> performers;

    private ResultFilter(int minDurationSeconds, List<String> exclusions, List<String> exactPhrases,
                         List<String> performers) {
        this.minDurationSeconds = minDurationSeconds;
        this.exclusions = exclusions;
        this.exactPhrases = exactPhrases;
        this.performers = performers;
    }

    static ResultFilter of(ParsedQuery parsed, int minDurationSeconds) {
        return new ResultFilter(
                minDurationSeconds,
                parsed.exclusions().stream().map(ResultFilter::lower).toList(),
                parsed.exactPhrases().stream().map(ResultFilter::lower).toList(),
                parsed.performers().stream().map(ResultFilter::compact).filter(p -> !p.isEmpty()).toList());
    }

    @Override
    public boolean test(Result result) {
        if (minDurationSeconds > 0 && result.durationSeconds() > 0 && result.durationSeconds() < minDurationSeconds) {
            return false;
        }

        String title = lower(result.title());
        for (String exclusion : exclusions) {
            if (title.contains(exclusion)) return false;
            for (String tag : result.tags()) {
                if (tag.contains(exclusion)) return false;
            }
        }

        for (String phrase : exactPhrases) {
            if (!title.contains(phrase)) return false;
        }

        return performers.isEmpty() || performers.stream().anyMatch(performer -> mentions(result, performer));
    }

    private static boolean mentions(Result result, String performer) {
        if (compact(result.performer()).contains(performer)) return true;
        if (compact(result.title()).contains(performer)) return true;
        for (String tag : result.tags()) {
            if (compact(tag).contains(performer)) return true;
        }
        return false;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    // "Jane Doe", "jane_doe" and "jane-doe" all compare as "janedoe"
    private static String compact(String value) {
        return lower(value).replaceAll("[^\\p{L}\\p{N}]", "");
    }
}
