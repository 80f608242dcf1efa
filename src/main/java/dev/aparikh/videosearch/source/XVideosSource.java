package dev.aparikh.videosearch.source;

import dev.aparikh.videosearch.extract.DurationParser;
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
 * XVideos search page scraper. Pages are zero-based on the site.
 */
class XVideosSource extends AbstractSourceAdapter {

    static final String ITEM_SELECTOR = "div.thumb-block, div.mozaique div.thumb";

    static final SourceDescriptor DESCRIPTOR = new SourceDescriptor(
            "xvideos", "XVideos", "https://www.xvideos.com", 1,
            EnumSet.of(Capability.PREVIEW, Capability.DURATION, Capability.VIEWS, Capability.QUALITY),
            ExtractionMethod.HTML, "data-preview");

    XVideosSource(SourceFetcher fetcher) {
        super(DESCRIPTOR, EnumSet.of(Feature.PAGINATION, Feature.SORTING), fetcher);
    }

    @Override
    protected String searchUrl(String query, int page) {
        return baseUrl() + "/?k=" + encode(query) + "&p=" + (page - 1);
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
        Element link = card.selectFirst("a");
        if (link == null || link.attr("href").isBlank()) return Optional.empty();
        String url = UrlNormalizer.absolute(link.attr("href"), baseUrl());
        if (PremiumContent.isPremium(card, url)) return Optional.empty();

        Element titleElement = card.selectFirst("p.title a, a[title]");
        String title = "";
        if (titleElement != null) {
            title = TextCleaner.clean(titleElement.attr("title"));
            if (title.isEmpty()) title = TextCleaner.clean(titleElement.text());
        }
        if (title.isEmpty()) title = TextCleaner.clean(link.attr("title"));

        Element img = card.selectFirst("img");
        String preview = firstAttr(img, List.of("data-preview"));
        if (preview.isEmpty()) {
            preview = firstAttr(card.selectFirst("[data-preview]"), List.of("data-preview"));
        }

        DurationParser.ParsedDuration duration = DurationParser.parse(text(card, ".duration, span.duration"));
        ViewsParser.ParsedViews views = ViewsParser.parse(text(card, ".metadata span.views, .views"));

        return Result.builder()
                .source(descriptor())
                .url(url)
                .title(title)
                .thumbnail(UrlNormalizer.media(firstAttr(img, List.of("data-src", "src")), baseUrl()))
                .previewUrl(UrlNormalizer.media(preview, baseUrl()))
                .duration(duration.display(), duration.seconds())
                .views(views.display(), views.count())
                .quality(extractQuality(card))
                .build();
    }
}
