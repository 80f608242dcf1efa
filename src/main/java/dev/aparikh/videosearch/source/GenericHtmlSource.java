package dev.aparikh.videosearch.source;

import dev.aparikh.videosearch.extract.GenericItemExtractor;
import dev.aparikh.videosearch.model.ExtractionMethod;
import dev.aparikh.videosearch.model.Result;
import dev.aparikh.videosearch.model.SourceDescriptor;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Adapter for sites without bespoke parsing: selects result cards with the site's item
 * selector and hands each card to {@link GenericItemExtractor}.
 */
class GenericHtmlSource extends AbstractSourceAdapter {

    private final GenericSiteDefinition site;

    GenericHtmlSource(GenericSiteDefinition site, SourceFetcher fetcher) {
        super(new SourceDescriptor(site.name(), site.displayName(), site.baseUrl(), site.tier(),
                site.capabilities(), ExtractionMethod.HTML, ""), site.features(), fetcher);
        this.site = site;
    }

    @Override
    protected String searchUrl(String query, int page) {
        return baseUrl() + site.searchPath()
                .replace("{query}", encode(query))
                .replace("{page}", Integer.toString(page));
    }

    @Override
    protected List<Result> parse(String body) {
        List<Result> results = new ArrayList<>();
        for (Element card : cards(body, site.itemSelector())) {
            GenericItemExtractor.extract(card, baseUrl(), descriptor()).ifPresent(results::add);
        }
        return results;
    }
}
