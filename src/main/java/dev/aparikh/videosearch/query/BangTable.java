package dev.aparikh.videosearch.query;

import dev.aparikh.videosearch.config.ConfigurationException;
import dev.aparikh.videosearch.source.SourceAdapter;
import dev.aparikh.videosearch.source.SourceRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable alias-to-source routing table used by {@code !bang} directives.
 * The shortest alias of a source (first declared on ties) is its short code.
 */
public final class BangTable {

    private static final Pattern ALIAS = Pattern.compile("[a-z0-9]+");

    static final Map<String, String> BUILT_IN = builtIn();

    private final Map<String, String> aliases;
    private final Map<String, List<String>> aliasesBySource;
    private final Map<String, String> displayNames;

    private BangTable(Map<String, String> aliases, Map<String, String> displayNames) {
        Map<String, List<String>> bySource = new LinkedHashMap<>();
        aliases.forEach((alias, source) -> bySource.computeIfAbsent(source, s -> new ArrayList<>()).add(alias));
        bySource.replaceAll((source, list) -> List.copyOf(list));
        this.aliases = Collections.unmodifiableMap(aliases);
        this.aliasesBySource = Collections.unmodifiableMap(bySource);
        this.displayNames = Map.copyOf(displayNames);
    }

    /**
     * Builds the table from the built-in aliases plus {@code custom}; a custom alias replaces a
     * built-in one with the same key.
     *
     * @throws ConfigurationException when an alias is malformed or targets an unregistered source
     */
    public static BangTable create(Map<String, String> custom, SourceRegistry registry) {
        Map<String, String> merged = new LinkedHashMap<>(BUILT_IN);
        if (custom != null) {
            custom.forEach((alias, source) -> merged.put(
                    alias == null ? "" : alias.trim().toLowerCase(Locale.ROOT),
                    source == null ? "" : source.trim()));
        }

        Map<String, String> displayNames = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : merged.entrySet()) {
            if (!ALIAS.matcher(entry.getKey()).matches()) {
                throw new ConfigurationException("Invalid bang alias '" + entry.getKey() + "': must match [a-z0-9]+");
            }
            SourceAdapter adapter = registry.find(entry.getValue())
                    .orElseThrow(() -> new ConfigurationException(
                            "Bang alias '" + entry.getKey() + "' targets unknown source '" + entry.getValue() + "'"));
            displayNames.put(adapter.name(), adapter.displayName());
        }
        return new BangTable(merged, displayNames);
    }

    public Optional<String> resolve(String alias) {
        if (alias == null) return Optional.empty();
        return Optional.ofNullable(aliases.get(alias.toLowerCase(Locale.ROOT)));
    }

    public List<String> aliasesFor(String source) {
        return aliasesBySource.getOrDefault(source, List.of());
    }

    public Optional<String> shortCode(String source) {
        String shortest = null;
        for (String alias : aliasesFor(source)) {
            if (shortest == null || alias.length() < shortest.length()) {
                shortest = alias;
            }
        }
        return Optional.ofNullable(shortest);
    }

    /**
     * All aliases in table order.
     */
    public Map<String, String> aliases() {
        return aliases;
    }

    /**
     * One entry per routed source, in the order sources first appear in the table.
     */
    public List<BangInfo> entries() {
        List<BangInfo> entries = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : aliasesBySource.entrySet()) {
            String source = entry.getKey();
            List<String> sourceAliases = entry.getValue();
            String primary = sourceAliases.contains(source) ? source : sourceAliases.get(0);
            entries.add(new BangInfo(
                    "!" + primary,
                    source,
                    displayNames.getOrDefault(source, source),
                    "!" + shortCode(source).orElse(primary),
                    sourceAliases.stream().map(alias -> "!" + alias).toList()));
        }
        return entries;
    }

    private static Map<String, String> builtIn() {
        Map<String, String> table = new LinkedHashMap<>();
        String[][] rows = {
                {"ph", "pornhub"}, {"pornhub", "pornhub"},
                {"xv", "xvideos"}, {"xvideos", "xvideos"},
                {"xn", "xnxx"}, {"xnxx", "xnxx"},
                {"rt", "redtube"}, {"redtube", "redtube"},
                {"xh", "xhamster"}, {"xhamster", "xhamster"},
                {"ep", "eporner"}, {"eporner", "eporner"},
                {"yp", "youporn"}, {"youporn", "youporn"},
                {"pmd", "pornmd"}, {"pornmd", "pornmd"},
                {"4t", "4tube"}, {"4tube", "4tube"},
                {"fux", "fux"},
                {"pt", "porntube"}, {"porntube", "porntube"},
                {"yj", "youjizz"}, {"youjizz", "youjizz"},
                {"sp", "sunporno"}, {"sunporno", "sunporno"},
                {"tx", "txxx"}, {"txxx", "txxx"},
                {"nv", "nuvid"}, {"nuvid", "nuvid"},
                {"tna", "tnaflix"}, {"tnaflix", "tnaflix"},
                {"dt", "drtuber"}, {"drtuber", "drtuber"},
                {"emp", "empflix"}, {"empflix", "empflix"},
                {"hp", "hellporno"}, {"hellporno", "hellporno"},
                {"ap", "alphaporno"}, {"alphaporno", "alphaporno"},
                {"pf", "pornflip"}, {"pornflip", "pornflip"},
                {"zp", "zenporn"}, {"zenporn", "zenporn"},
                {"gp", "gotporn"}, {"gotporn", "gotporn"},
                {"hz", "hdzog"}, {"hdzog", "hdzog"},
                {"xxxy", "xxxymovies"}, {"xxxymovies", "xxxymovies"},
                {"lhp", "lovehomeporn"}, {"lovehomeporn", "lovehomeporn"},
                {"pb", "pornerbros"}, {"pornerbros", "pornerbros"},
                {"nk", "nonktube"}, {"nonktube", "nonktube"},
                {"np", "nubilesporn"}, {"nubilesporn", "nubilesporn"},
                {"pbox", "pornbox"}, {"pornbox", "pornbox"},
                {"ptop", "porntop"}, {"porntop", "porntop"},
                {"pnt", "pornotube"}, {"pornotube", "pornotube"},
                {"phd", "pornhd"}, {"pornhd", "pornhd"},
                {"xb", "xbabe"}, {"xbabe", "xbabe"},
                {"p1", "pornone"}, {"pornone", "pornone"},
                {"phat", "pornhat"}, {"pornhat", "pornhat"},
                {"ptrex", "porntrex"}, {"porntrex", "porntrex"},
                {"hq", "hqporner"}, {"hqporner", "hqporner"},
                {"vj", "vjav"}, {"vjav", "vjav"},
                {"ff", "flyflv"}, {"flyflv", "flyflv"},
                {"t8", "tube8"}, {"tube8", "tube8"},
                {"any", "anyporn"}, {"anyporn", "anyporn"},
                {"tg", "tubegalore"}, {"tubegalore", "tubegalore"},
                {"ml", "motherless"}, {"motherless", "motherless"},
                {"3m", "3movs"}, {"3movs", "3movs"},
        };
        for (String[] row : rows) {
            table.put(row[0], row[1]);
        }
        return Collections.unmodifiableMap(table);
    }
}
