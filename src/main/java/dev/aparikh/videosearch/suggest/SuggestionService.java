package dev.aparikh.videosearch.suggest;

import dev.aparikh.videosearch.query.BangInfo;
import dev.aparikh.videosearch.query.BangTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Autocomplete over the bang table, the performer table and the term table.
 * Tables are immutable; {@link #reload} swaps them as a unit.
 */
public class SuggestionService {

    private static final Logger LOG = LoggerFactory.getLogger(SuggestionService.class);

    static final int MIN_BANG_PREFIX = 1;
    static final int MIN_TERM_PREFIX = 2;
    static final int BANG_START_COUNT = 10;
    public static final int RELATED_COUNT = 8;

    private final BangTable bangTable;
    private final List<String> builtInTerms;
    private final List<String> builtInPerformers;
    private final int maxResults;
    private final AtomicReference<Tables> tables = new AtomicReference<>();

    private record Tables(List<String> terms, List<String> performers) {
    }

    public SuggestionService(BangTable bangTable, List<String> customTerms, List<String> performers, int maxResults) {
        this(bangTable, BuiltInTerms.loadTerms(), BuiltInTerms.loadPerformers(), customTerms, performers, maxResults);
    }

    SuggestionService(BangTable bangTable, List<String> builtInTerms, List<String> builtInPerformers,
                      List<String> customTerms, List<String> performers, int maxResults) {
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be >= 1");
        }
        this.bangTable = bangTable;
        this.builtInTerms = List.copyOf(builtInTerms);
        this.builtInPerformers = List.copyOf(builtInPerformers);
        this.maxResults = maxResults;
        tables.set(buildTables(customTerms, performers));
    }

    /**
     * Replaces the configured custom terms and performers. Bundled entries are kept.
     */
    public void reload(List<String> customTerms, List<String> performers) {
        Tables next = buildTables(customTerms, performers);
        tables.set(next);
        LOG.info("Suggestion tables reloaded: {} terms, {} performers", next.terms().size(), next.performers().size());
    }

    /**
     * One suggestion per source whose aliases or name match {@code prefix} (without the leading {@code !}).
     */
    public List<BangSuggestion> bangs(String prefix, int max) {
        String needle = normalize(prefix);
        if (needle.length() < MIN_BANG_PREFIX || max <= 0) return List.of();

        List<BangSuggestion> matches = new ArrayList<>();
        for (BangInfo entry : bangTable.entries()) {
            int best = SuggestionRanker.score(entry.engineName(), needle);
            for (String alias : bangTable.aliasesFor(entry.engineName())) {
                best = Math.max(best, SuggestionRanker.score(alias, needle));
            }
            if (best > 0) {
                matches.add(toSuggestion(entry, best));
            }
        }
        matches.sort(Comparator.comparingInt(BangSuggestion::score).reversed());
        return matches.size() > max ? List.copyOf(matches.subList(0, max)) : matches;
    }

    public List<PerformerSuggestion> performers(String prefix, int max) {
        String needle = normalize(prefix);
        if (needle.length() < MIN_TERM_PREFIX) return List.of();
        return SuggestionRanker.rank(tables.get().performers(), needle, max).stream()
                .map(scored -> new PerformerSuggestion(scored.value(), scored.score()))
                .toList();
    }

    public List<TermSuggestion> terms(String prefix, int max) {
        String needle = normalize(prefix);
        if (needle.length() < MIN_TERM_PREFIX) return List.of();
        return SuggestionRanker.rank(tables.get().terms(), needle, max).stream()
                .map(scored -> new TermSuggestion(scored.value(), scored.score()))
                .toList();
    }

    /**
     * Terms sharing words with {@code query}, most related first, never the query itself.
     */
    public List<String> related(String query, int max) {
        String phrase = normalize(query);
        if (phrase.isEmpty() || max <= 0) return List.of();

        List<SuggestionRanker.Scored> matches = new ArrayList<>();
        for (String term : tables.get().terms()) {
            if (term.equalsIgnoreCase(phrase)) continue;
            int score = SuggestionRanker.relatedness(term, phrase);
            if (score > 0) {
                matches.add(new SuggestionRanker.Scored(term, score));
            }
        }
        matches.sort(Comparator.comparingInt(SuggestionRanker.Scored::score).reversed());
        return matches.stream().limit(max).map(SuggestionRanker.Scored::value).toList();
    }

    public List<String> popular(int count) {
        if (count <= 0) return List.of();
        return BuiltInTerms.POPULAR.subList(0, Math.min(count, BuiltInTerms.POPULAR.size()));
    }

    /**
     * Full bang table for listing.
     */
    public List<BangInfo> allBangs() {
        return bangTable.entries();
    }

    /**
     * Picks the suggestion kind from the shape of the input and completes its last word.
     */
    public AutocompleteResponse autocomplete(String q) {
        String input = q == null ? "" : q;
        if (input.isBlank()) {
            return new AutocompleteResponse(AutocompleteResponse.POPULAR, popular(maxResults), null);
        }
        if (input.startsWith("!") && input.length() > 1 && !input.contains(" ")) {
            return new AutocompleteResponse(AutocompleteResponse.BANG, bangs(input.substring(1), maxResults), null);
        }
        if (input.endsWith(" !")) {
            List<BangSuggestion> first = bangTable.entries().stream()
                    .limit(BANG_START_COUNT)
                    .map(entry -> toSuggestion(entry, 0))
                    .toList();
            return new AutocompleteResponse(AutocompleteResponse.BANG_START, first, null);
        }

        String[] words = input.trim().split("\\s+");
        String lastWord = words[words.length - 1];
        if (lastWord.length() > 1 && lastWord.startsWith("!")) {
            return new AutocompleteResponse(AutocompleteResponse.BANG,
                    bangs(lastWord.substring(1), maxResults), lastWord);
        }
        if (lastWord.length() > 1 && lastWord.startsWith("@")) {
            return new AutocompleteResponse(AutocompleteResponse.PERFORMER,
                    performers(lastWord.substring(1), maxResults), lastWord);
        }
        return new AutocompleteResponse(AutocompleteResponse.SEARCH, terms(lastWord, maxResults), null);
    }

    private Tables buildTables(List<String> customTerms, List<String> performers) {
        List<String> terms = new ArrayList<>(builtInTerms);
        if (customTerms != null) terms.addAll(customTerms);
        List<String> names = new ArrayList<>();
        if (performers != null) names.addAll(performers);
        names.addAll(builtInPerformers);
        return new Tables(dedupe(terms), dedupe(names));
    }

    private static List<String> dedupe(List<String> values) {
        Map<String, String> unique = new LinkedHashMap<>();
        for (String value : values) {
            if (value == null || value.isBlank()) continue;
            String trimmed = value.trim();
            unique.putIfAbsent(trimmed.toLowerCase(Locale.ROOT), trimmed);
        }
        return List.copyOf(unique.values());
    }

    private static BangSuggestion toSuggestion(BangInfo entry, int score) {
        return new BangSuggestion(entry.bang(), entry.engineName(), entry.displayName(), entry.shortCode(), score);
    }

    private static String normalize(String prefix) {
        return prefix == null ? "" : prefix.trim().toLowerCase(Locale.ROOT);
    }
}
