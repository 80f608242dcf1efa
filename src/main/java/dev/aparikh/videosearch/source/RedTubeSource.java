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
 * RedTube search page scraper. The title link, not the thumbnail link, carries the title.
 */
class RedTubeSource extends AbstractSourceAdapter {

    static final String ITEM_SELECTOR = "li.videoblock_list, li.thumbnail-card, li.videoblock-default, li.video-box";

    static final SourceDescriptor DESCRIPTOR = new SourceDescriptor(
            "redtube", "RedTube", "https://www.redtube.com", 1,
            EnumSet.of(Capability.PREVIEW, Capability.DURATION, Capability.VIEWS, Capability.RATING, Capability.QUALITY),
            ExtractionMethod.HTML, "data-mediabook");

    RedTubeSource(SourceFetcher fetcher) {
        super(DESCRIPTOR, EnumSet.of(Feature.PAGINATION, Feature.SORTING, Feature.THUMBNAIL_PREVIEW), fetcher);
    }

    @Override
    protected String searchUrl(String query, int page) {
        return baseUrl() + "/?search=" + encode(query) + "&page=" + page;
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
        Element titleElement = card.selectFirst("a.video-title-text, a.tm_video_title");
        String title = "";
        String href = "";
        if (titleElement != null) {
            title = TextCleaner.clean(titleElement.attr("title"));
            if (title.isEmpty()) title = TextCleaner.clean(titleElement.text());
            href = titleElement.attr("href");
        }
        if (title.isEmpty()) return Optional.empty();
        if (href.isBlank()) {
            href = firstAttr(card.selectFirst("a.video_link, a.tm_video_link, a"), List.of("href"));
        }
        if (href.isBlank()) return Optional.empty();
        String url = UrlNormalizer.absolute(href, baseUrl());
        if (PremiumContent.isPremium(card, url)) return Optional.empty();

        Element img = card.selectFirst("img.js_thumbImageTag, img.thumb, img");
        String thumbnail = firstAttr(img, List.of("data-src", "data-srcset", "src"));
        if (thumbnail.startsWith("data:")) thumbnail = "";
        String preview = firstAttr(img, List.of("data-mediabook")).replace("&amp;", "&");

        DurationParser.ParsedDuration duration =
                DurationParser.parse(text(card, ".video-properties, .tm_video_duration, .duration span"));
        ViewsParser.ParsedViews views = ViewsParser.parse(text(card, ".info-views"));

        return Result.builder()
                .source(descriptor())
                .url(url)
                .title(title)
                .thumbnail(UrlNormalizer.media(thumbnail, baseUrl()))
                .previewUrl(UrlNormalizer.media(preview, baseUrl()))
                .duration(duration.display(), duration.seconds())
                .views(views.display(), views.count())
                .rating(RatingParser.parse(text(card, ".video-rating, .rating_percent")))
                .quality(extractQuality(card))
                .build();
    }
}
