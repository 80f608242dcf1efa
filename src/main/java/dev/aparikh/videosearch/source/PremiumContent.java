package dev.aparikh.videosearch.source;

import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;

/**
 * Detects pay-walled cards that bespoke adapters drop from their listings.
 */
final class PremiumContent {

    private static final List<String> URL_MARKERS = List.of("gold", "premium", "vip", "paid");

    private static final String BADGE_SELECTOR = "[class*=premium], [class*=gold], [class*=vip], "
            + "[class*=paid], [class*=exclusive], [class*=members-only]";

    private PremiumContent() {
    }

    static boolean isPremium(Element card, String url) {
        String lowerUrl = url.toLowerCase(Locale.ROOT);
        for (String marker : URL_MARKERS) {
            if (lowerUrl.contains(marker)) return true;
        }
        return card.selectFirst(BADGE_SELECTOR) != null;
    }
}
