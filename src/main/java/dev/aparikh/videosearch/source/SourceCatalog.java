package dev.aparikh.videosearch.source;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

import static dev.aparikh.videosearch.source.GenericSiteDefinition.of;

/**
 * Every source the service knows about, in listing order.
 */
public final class SourceCatalog {

    static final List<GenericSiteDefinition> GENERIC_SITES = List.of(
            // tier 1 and 2
            of("xnxx", "XNXX", "https://www.xnxx.com", 1, "/search/{query}/{page}", "div.thumb-block"),
            of("youporn", "YouPorn", "https://www.youporn.com", 2, "/search/?query={query}&page={page}", ".video-box"),
            of("pornmd", "PornMD", "https://www.pornmd.com", 2, "/straight/{query}?page={page}", "div.card.sub"),

            // tier 3
            of("4tube", "4Tube", "https://www.4tube.com", 3, "/search?q={query}&p={page}", "div.card"),
            of("fux", "Fux", "https://www.fux.com", 3, "/search?q={query}&p={page}", "div.card"),
            of("porntube", "PornTube", "https://www.porntube.com", 3, "/search?q={query}&p={page}", "div.video_container"),
            of("youjizz", "YouJizz", "https://www.youjizz.com", 3, "/search/{query}-{page}.html", "div.video-item, li.video-item"),
            of("sunporno", "SunPorno", "https://www.sunporno.com", 3, "/search/videos?q={query}", "a.item.drclass"),
            of("txxx", "Txxx", "https://www.txxx.com", 3, "/search/{query}/?page={page}", "div.thumb-item, div.video-item"),
            of("nuvid", "Nuvid", "https://www.nuvid.com", 3, "/search/{query}/", "a.th.video-thumb"),
            of("tnaflix", "TNAFlix", "https://www.tnaflix.com", 3, "/search.php?what={query}&page={page}", "div.col-xs-6.col-md-4"),
            of("drtuber", "DrTuber", "https://www.drtuber.com", 3,
                    "/search/videos?search_type=videos&search_id={query}&p={page}", "a.th.ch-video"),
            of("empflix", "EMPFlix", "https://www.empflix.com", 3, "/search.php?what={query}&page={page}",
                    "div.item-video, div.video-item"),
            of("hellporno", "HellPorno", "https://hellporno.com", 3, "/search/?q={query}", "div.video-thumb"),
            of("alphaporno", "AlphaPorno", "https://www.alphaporno.com", 3, "/search/{query}/?page={page}", "li.thumb"),
            of("pornflip", "PornFlip", "https://www.pornflip.com", 3, "/search?search={query}&page={page}",
                    "div.video-item, div.thumb-item"),
            of("zenporn", "ZenPorn", "https://zenporn.com", 3, "/search/{query}/?page={page}", "article.thumb"),
            of("gotporn", "GotPorn", "https://www.gotporn.com", 3, "/search?q={query}&page={page}", "div.card.sub"),
            of("hdzog", "HDZog", "https://www.hdzog.com", 3, "/search/{query}/?page={page}", "div.video, div.video-item"),
            of("xxxymovies", "XXXYMovies", "https://www.xxxymovies.com", 3, "/search/{query}/?page={page}",
                    "div.video-item, div.item"),
            of("lovehomeporn", "LoveHomePorn", "https://lovehomeporn.com", 3, "/search/{query}/?page={page}",
                    "div.video-item, div.item"),

            // tier 4
            of("pornerbros", "PornerBros", "https://www.pornerbros.com", 4, "/search?q={query}&page={page}", "div.card.sub"),
            of("nonktube", "NonkTube", "https://www.nonktube.com", 4, "/search/{query}/?p={page}", "div.video-item, div.thumb"),
            of("nubilesporn", "NubilesPorn", "https://nubiles-porn.com", 4, "/search/{query}/?page={page}",
                    "div.scene, article.video, div.video-item"),
            of("pornbox", "Pornbox", "https://pornbox.com", 4, "/search?q={query}&page={page}",
                    "div.video-item, div.item, article.video"),
            of("porntop", "PornTop", "https://porntop.com", 4, "/?s={query}&page={page}", "div.item"),
            of("pornotube", "Pornotube", "https://pornotube.com", 4, "/search?q={query}&page={page}",
                    "div.video-item, div.thumb, article.video"),
            of("vporn", "VPorn", "https://www.vporn.com", 4, "/search?q={query}&page={page}", "div.video-item, div.thumb-item"),
            of("pornhd", "PornHD", "https://www.pornhd.com", 4, "/search?search={query}&page={page}", "div.card.sub"),
            of("xbabe", "XBabe", "https://xbabe.com", 4, "/?s={query}&page={page}", "div.thumb"),
            of("pornone", "PornOne", "https://pornone.com", 4, "/search/?q={query}&page={page}",
                    "div.video-item, div.thumb, article.video"),
            of("pornhat", "PornHat", "https://www.pornhat.com", 4, "/search/{query}/?page={page}", "div.video-item, div.item"),
            of("porntrex", "PornTrex", "https://www.porntrex.com", 4, "/search/{query}/?page={page}", "div.video-item, div.thumb"),
            of("hqporner", "Hqporner", "https://hqporner.com", 4, "/?q={query}&p={page}", "div.box, div.video-item"),
            of("vjav", "VJAV", "https://vjav.com", 4, "/search/{query}/?page={page}", "div.video-item, article.video, div.item"),
            of("flyflv", "Flyflv", "https://www.flyflv.com", 4, "/search/{query}/?page={page}", "div.video-item, div.item"),
            of("tube8", "Tube8", "https://www.tube8.com", 4, "/searches?q={query}&page={page}", "div.video-box, div.thumbnail-card"),
            of("xtube", "Xtube", "https://www.xtube.com", 4, "/search/?q={query}&page={page}", "div.video-item, div.thumb"),

            // tier 5 and 6
            of("anyporn", "AnyPorn", "https://www.anyporn.com", 3, "/search/?q={query}&p={page}", "div.item"),
            of("superporn", "SuperPorn", "https://www.superporn.com", 3, "/search/{query}?p={page}", "div.thumb-video"),
            of("tubegalore", "TubeGalore", "https://www.tubegalore.com", 3, "/search/?q={query}&p={page}", "div.card"),
            of("motherless", "Motherless", "https://motherless.com", 3, "/term/videos/{query}?page={page}",
                    "div.thumb-container, div.thumb"),
            of("keezmovies", "KeezMovies", "https://www.keezmovies.com", 3, "/search/{query}?page={page}",
                    "li.video-item, div.video-item, div.videoblock"),
            of("spankwire", "SpankWire", "https://www.spankwire.com", 3, "/search/videos/{query}?page={page}",
                    "li.video-item, div.video-item, div.videoblock"),
            of("extremetube", "ExtremeTube", "https://www.extremetube.com", 3, "/search/{query}/?page={page}",
                    "li.video-item, div.video-item, div.thumb-item"),
            of("3movs", "3Movs", "https://www.3movs.com", 3, "/search/{query}/?p={page}",
                    "div.video-item, div.thumb-item, li.thumb-item"),
            of("sleazyneasy", "SleazyNeasy", "https://www.sleazyneasy.com", 3, "/search/{query}/?page={page}",
                    "div.video-item, div.thumb-item, article.video")
    );

    private SourceCatalog() {
    }

    /**
     * Builds one adapter per known source: the bespoke ones first, then the generic sites.
     */
    public static List<SourceAdapter> create(SourceFetcher fetcher, ObjectMapper objectMapper) {
        List<SourceAdapter> adapters = new ArrayList<>();
        adapters.add(new PornHubSource(fetcher));
        adapters.add(new XVideosSource(fetcher));
        adapters.add(new RedTubeSource(fetcher));
        adapters.add(new XHamsterSource(fetcher, objectMapper));
        adapters.add(new EpornerSource(fetcher, objectMapper));
        for (GenericSiteDefinition site : GENERIC_SITES) {
            adapters.add(new GenericHtmlSource(site, fetcher));
        }
        return List.copyOf(adapters);
    }
}
