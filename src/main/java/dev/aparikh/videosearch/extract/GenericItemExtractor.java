package dev.aparikh.videosearch.extract;

import dev.aparikh.videosearch.model.Result;
import dev.aparikh.videosearch.model.SourceDescriptor;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Heuristic field extraction for a single result card in scraped markup.
 * <p>
 * Every field is resolved by an ordered list of strategies; the first one yielding a
 * non-empty value wins. A card without a link or without a title is skipped.
 */
public final class GenericItemExtractor {

    static final List<String> TITLE_SELECTORS = List.of(
            ".title, .name, .video-title, a.video-title, h4, h3",
            "span > em",
            "strong span, strong em"
    );

    static final List<String> THUMBNAIL_ATTRIBUTES = List.of("data-src", "data-original", "data-lazy-src", "src");

    static final List<String> PREVIEW_ATTRIBUTES = List.of(
            "data-mediabook", "data-preview", "data-video-preview", "data-rollover",
            "data-preview-url", "data-gif", "data-webm", "data-mp4",
            "data-thumb-url", "data-trailer", "data-teaser"
    );

    static final List<String> DURATION_SELECTORS = List.of(
            ".duration", ".dur", ".time", ".length", ".video-duration",
            "var.duration", "span.duration", ".thumb-icon.video-duration",
            "em.time_thumb em", ".time_thumb", ".video_duration", ".video__time",
            ".thumb__time", ".thumb-time", ".thumb-duration", ".video-time",
            "time", "[data-duration]", ".meta-duration", ".card-duration"
    );

    static final List<String> VIEWS_SELECTORS = List.of(
            ".views", ".view", ".cnt", "span.views", ".video-views",
            ".video__views", ".thumb__views", ".meta-views", ".stats",
            ".view-count", ".viewCount", ".video-count", ".added-views"
    );

    static final List<String> RATING_SELECTORS = List.of(
            ".rating", ".rate", ".video-rating", ".thumb__rating", ".score", ".likes", ".percent"
    );

    static final List<String> QUALITY_SELECTORS = List.of(
            ".quality", ".hd-badge", ".quality-badge",
            "[class*=quality]", "[class*=hd]", "[class*=4k]"
    );

    static final List<String> TAG_SELECTORS = List.of(
            ".tags a", ".tag a", ".categories a", ".category a",
            "a.tag", "a.category", ".video-tags a", ".video-categories a",
            ".thumb-tags a", ".card-tags a", ".keywords a",
            ".labels a", ".label", ".badge", ".chip"
    );

    static final List<String> PERFORMER_SELECTORS = List.of(
            ".pornstar", ".model", ".performer", ".actor", ".actress",
            ".uploader", ".author", ".channel", ".studio",
            "a.pornstar", "a.model", ".video-pornstar", ".video-model",
            "[data-pornstar]", "[data-model]", "[data-performer]"
    );

    /**
     * The pieces of a card every strategy may look at.
     */
    record Card(Element item, Element link, Element image, String baseUrl) {
    }

    private static final List<Function<Card, String>> TITLE_STRATEGIES = titleStrategies();

    private static final List<Function<Card, String>> PREVIEW_STRATEGIES = List.of(
            card -> firstAttr(card.item(), PREVIEW_ATTRIBUTES),
            card -> firstAttr(card.image(), PREVIEW_ATTRIBUTES),
            card -> firstAttr(card.link(), PREVIEW_ATTRIBUTES)
    );

    private static final List<Function<Card, String>> PERFORMER_STRATEGIES = List.of(
            card -> firstText(card.item(), PERFORMER_SELECTORS),
            card -> firstAttr(card.item(), List.of("data-pornstar", "data-model"))
    );

    private GenericItemExtractor() {
    }

    /**
     * Extracts a result from one card element.
     *
     * @param item    the card element (may itself be the link)
     * @param baseUrl base URL of the source, used to absolutize relative links and images
     * @param source  the source the card belongs to
     * @return the result, or empty when the card has no usable link or title
     */
    public static Optional<Result> extract(Element item, String baseUrl, SourceDescriptor source) {
        Element link = "a".equalsIgnoreCase(item.tagName()) ? item : item.selectFirst("a");
        if (link == null) return Optional.empty();
        String url = UrlNormalizer.absolute(link.attr("href"), baseUrl);
        if (url.isEmpty()) return Optional.empty();

        Card card = new Card(item, link, item.selectFirst("img"), baseUrl);
        String title = firstNonEmpty(card, TITLE_STRATEGIES);
        if (title.isEmpty()) return Optional.empty();

        DurationParser.ParsedDuration duration = extractDuration(item);
        ViewsParser.ParsedViews views = ViewsParser.parse(firstText(item, VIEWS_SELECTORS));

        return Result.builder()
                .source(source)
                .url(url)
                .title(title)
                .thumbnail(UrlNormalizer.media(firstAttr(card.image(), THUMBNAIL_ATTRIBUTES), baseUrl))
                .previewUrl(UrlNormalizer.media(firstNonEmpty(card, PREVIEW_STRATEGIES), baseUrl))
                .duration(duration.display(), duration.seconds())
                .views(views.display(), views.count())
                .rating(extractRating(item))
                .quality(extractQuality(item))
                .tags(extractTags(item))
                .performer(firstNonEmpty(card, PERFORMER_STRATEGIES))
                .build();
    }

    static DurationParser.ParsedDuration extractDuration(Element item) {
        for (String selector : DURATION_SELECTORS) {
            Element element = item.selectFirst(selector);
            if (element == null) continue;
            String text = firstAttr(element, List.of("data-content", "data-duration"));
            if (text.isEmpty()) {
                text = TextCleaner.clean(element.text());
            }
            if (!text.isEmpty()) {
                DurationParser.ParsedDuration parsed = DurationParser.parse(text);
                if (parsed.seconds() > 0) return parsed;
            }
        }
        return DurationParser.parse(item.attr("data-duration"));
    }

    static double extractRating(Element item) {
        for (String selector : RATING_SELECTORS) {
            Element element = item.selectFirst(selector);
            if (element == null) continue;
            double rating = RatingParser.parse(element.text());
            if (rating > 0) return rating;
        }
        return 0;
    }

    public static String extractQuality(Element item) {
        for (String selector : QUALITY_SELECTORS) {
            Element element = item.selectFirst(selector);
            if (element == null) continue;
            String text = TextCleaner.clean(element.text());
            if (!text.isEmpty()) return text;
            String classes = element.className().toLowerCase(Locale.ROOT);
            if (classes.contains("4k")) return "4K";
            if (classes.contains("hd")) return "HD";
        }
        return "";
    }

    static List<String> extractTags(Element item) {
        List<String> tags = new ArrayList<>();
        for (String selector : TAG_SELECTORS) {
            for (Element element : item.select(selector)) {
                tags.add(TextCleaner.clean(element.text()));
            }
        }
        splitInto(item.attr("data-tags"), tags);
        tags.add(item.attr("data-category"));
        splitInto(item.attr("data-categories"), tags);
        return tags;
    }

    private static List<Function<Card, String>> titleStrategies() {
        List<Function<Card, String>> strategies = new ArrayList<>();
        strategies.add(card -> TextCleaner.clean(card.link().attr("title")));
        strategies.add(card -> card.image() == null ? "" : TextCleaner.clean(card.image().attr("alt")));
        for (String selector : TITLE_SELECTORS) {
            strategies.add(card -> {
                Element element = card.item().selectFirst(selector);
                return element == null ? "" : TextCleaner.clean(element.text());
            });
        }
        strategies.add(card -> TextCleaner.clean(card.link().text()));
        return List.copyOf(strategies);
    }

    private static String firstNonEmpty(Card card, List<Function<Card, String>> strategies) {
        for (Function<Card, String> strategy : strategies) {
            String value = strategy.apply(card);
            if (value != null && !value.isBlank()) return value.trim();
        }
        return "";
    }

    public static String firstAttr(Element element, List<String> attributes) {
        if (element == null) return "";
        for (String attribute : attributes) {
            String value = element.attr(attribute);
            if (!value.isBlank()) return value.trim();
        }
        return "";
    }

    public static String firstText(Element item, List<String> selectors) {
        for (String selector : selectors) {
            Element element = item.selectFirst(selector);
            if (element == null) continue;
            String text = TextCleaner.clean(element.text());
            if (!text.isEmpty()) return text;
        }
        return "";
    }

    /**
     * Cleaned text of the first element matching {@code selector}, or an empty string.
     */
    public static String text(Element item, String selector) {
        Element element = item.selectFirst(selector);
        return element == null ? "" : TextCleaner.clean(element.text());
    }

    private static void splitInto(String csv, List<String> target) {
        if (csv == null || csv.isBlank()) return;
        for (String part : csv.split(",")) {
            target.add(part);
        }
    }
}
