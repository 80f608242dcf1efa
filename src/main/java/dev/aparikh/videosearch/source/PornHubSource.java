package dev.aparikh.videosearch.source;

import dev.aparikh.videosearch.extract.DurationParser;
import dev.aparikh.videosearch.extract.RatingParser;
import dev.aparikh.videosearch.extract.TextCleaner;
import dev.aparikh.videosearch.extract.UrlNormalizer;
import dev.aparikh.videosearch.extract.ViewsParser;
import dev.aparikh.videosearch.model.Capability;
import dev.aparikh.videosearch.model.ExtractionMethod;
import dev.aparikh.videosearch.model.Feature;
import dev.aparikh.videosearch.model.Result;
import dev.aparikh.videosearch.model.SourceDescriptor;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static dev.aparikh.videosearch.extract.GenericItemExtractor.extractQuality;
import static dev.aparikh.videosearch.extract.GenericItemExtractor.firstAttr;
import static dev.aparikh.videosearch.extract.GenericItemExtractor.text;

/**
 * PornHub search page scraper. Preview clips come from the {@code data-mediabook} attribute.
 */
class PornHubSource extends AbstractSourceAdapter {

    static final String ITEM_SELECTOR = "li.videoBox, li.pcVideoListItem, div.phimage";

    static final SourceDescriptor DESCRIPTOR = new SourceDescriptor(
            "pornhub", "PornHub", "https://www.pornhub.com", 1,
            EnumSet.of(Capability.PREVIEW, Capability.DURATION, Capability.VIEWS, Capability.RATING, Capability.QUALITY),
            ExtractionMethod.HTML, "data-mediabook");

    PornHubSource(SourceFetcher fetcher) {
        super(DESCRIPTOR, EnumSet.of(Feature.PAGINATION, Feature.SORTING, Feature.THUMBNAIL_PREVIEW), fetcher);
    }

    @Override
    protected String searchUrl(String query, int page) {
        return baseUrl() + "/video/search?search=" + encode(query) + "&page=" + page;
    }

    @Override
    protected List<Result> parse(String body) {
        List<Result> results = new ArrayList<>();
        for (Element card : cards(body, ITEM_SELECTOR)) {
            parseCard(card).ifPresent(results::add);
        }
        return results;
    }

    private Optional<Result> parseCard(Element card) {
        Element link = card.selectFirst("a.linkVideoThumb, a.videoPreviewBg, a");
        if (link == null || link.attr("href").isBlank()) return Optional.empty();
        String url = UrlNormalizer.absolute(link.attr("href"), baseUrl());
        if (PremiumContent.isPremium(card, url)) return Optional.empty();

        Element titleElement = card.selectFirst("span.title a, a[title]");
        String title = "";
        if (titleElement != null) {
            title = TextCleaner.clean(titleElement.attr("title"));
            if (title.isEmpty()) title = TextCleaner.clean(titleElement.text());
        }
        if (title.isEmpty()) title = TextCleaner.clean(link.attr("title"));

        Element img = card.selectFirst("img");
        String thumbnail = "";
        String preview = "";
        if (img != null) {
            thumbnail = firstAttr(img, List.of("data-thumb_url", "data-src", "data-mediumthumb", "src"));
            preview = img.attr("data-mediabook");
        }
        if (preview.isBlank()) preview = link.attr("data-mediabook");

        DurationParser.ParsedDuration duration = DurationParser.parse(text(card, "var.duration, .duration, .time"));
        ViewsParser.ParsedViews views = ViewsParser.parse(text(card, "var.views, .views, span.views"));

        return Result.builder()
                .source(descriptor())
                .url(url)
                .title(title)
                .thumbnail(UrlNormalizer.media(thumbnail, baseUrl()))
                .previewUrl(UrlNormalizer.media(preview, baseUrl()))
                .duration(duration.display(), duration.seconds())
                .views(views.display(), views.count())
                .rating(RatingParser.parse(text(card, ".rating-container .value, .value")))
                .quality(extractQuality(card))
                .build();
    }

}
