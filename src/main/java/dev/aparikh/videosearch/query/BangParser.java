package dev.aparikh.videosearch.query;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits a raw query into plain search words and directives.
 * <ul>
 *     <li>{@code "exact phrase"} requires the phrase in the title</li>
 *     <li>{@code !alias} routes the search to the aliased source</li>
 *     <li>{@code @name} filters by performer</li>
 *     <li>{@code -word} drops results mentioning the word</li>
 * </ul>
 * An unknown {@code !token} stays in the search words and is reported as the invalid bang.
 */
public class BangParser {

    private final BangTable bangs;

    public BangParser(BangTable bangs) {
        this.bangs = bangs;
    }

    public ParsedQuery parse(String raw) {
        String original = raw == null ? "" : raw;
        List<String> phrases = new ArrayList<>();
        String remaining = extractPhrases(original, phrases);

        Set<String> sources = new LinkedHashSet<>();
        Set<String> performers = new LinkedHashSet<>();
        List<String> exclusions = new ArrayList<>();
        List<String> words = new ArrayList<>();
        boolean hasBang = false;
        String invalidBang = null;

        for (String token : remaining.trim().split("\\s+")) {
            if (token.isEmpty()) continue;
            if (token.length() > 1 && token.charAt(0) == '!') {
                String source = bangs.resolve(token.substring(1)).orElse(null);
                if (source != null) {
                    hasBang = true;
                    sources.add(source);
                } else {
                    invalidBang = token;
                    words.add(token);
                }
            } else if (token.length() > 1 && token.charAt(0) == '@') {
                performers.add(token.substring(1).toLowerCase(Locale.ROOT));
            } else if (token.length() > 1 && token.charAt(0) == '-') {
                exclusions.add(token.substring(1).toLowerCase(Locale.ROOT));
            } else {
                words.add(token);
            }
        }

        return new ParsedQuery(original, String.join(" ", words).trim(), new ArrayList<>(sources), phrases,
                exclusions, new ArrayList<>(performers), hasBang, invalidBang);
    }

    /**
     * Removes matched {@code "..."} pairs from {@code text}, collecting their trimmed, non-empty contents.
     * An unmatched quote is left in place.
     */
    static String extractPhrases(String text, List<String> phrases) {
        StringBuilder remaining = new StringBuilder();
        int cursor = 0;
        while (true) {
            int start = text.indexOf('"', cursor);
            if (start < 0) break;
            int end = text.indexOf('"', start + 1);
            if (end < 0) break;
            String phrase = text.substring(start + 1, end).trim();
            if (!phrase.isEmpty()) {
                phrases.add(phrase);
            }
            remaining.append(text, cursor, start).append(' ');
            cursor = end + 1;
        }
        remaining.append(text.substring(cursor));
        return remaining.toString();
    }
}
