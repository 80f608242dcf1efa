package dev.aparikh.videosearch.extract;

import dev.aparikh.videosearch.model.Capability;
import dev.aparikh.videosearch.model.ExtractionMethod;
import dev.aparikh.videosearch.model.Result;
import dev.aparikh.videosearch.model.SourceDescriptor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class GenericItemExtractorTest {

    private static final String BASE = "https://tube.example.com";

    private static final SourceDescriptor SOURCE = new SourceDescriptor(
            "example", "Example Tube", BASE, 3, Set.of(Capability.DURATION, Capability.VIEWS),
            ExtractionMethod.HTML, null);

    private static Element card(String html) {
        return Jsoup.parseBodyFragment(html, BASE).body().child(0);
    }

    @Test
    void extractsEveryFieldFromAFullCard() {
        Element item = card("""
                <div class="thumb" data-tags="Outdoor,Beach">
                  <a href="/video/123/sunset" title="Sunset at the beach">
                    <img data-src="//cdn.example.com/t/123.jpg" src="data:image/gif;base64,AAAA"
                         data-preview="/p/123.mp4" alt="ignored alt">
                  </a>
                  <span class="duration">10:05</span>
                  <span class="views">1.5M views</span>
                  <span class="rating">91%</span>
                  <span class="quality">1080p</span>
                  <div class="tags"><a href="/t/a">Sunset</a><a href="/t/b">x</a></div>
                  <a class="model" href="/m/1">Jane Roe</a>
                </div>
                """);

        Optional<Result> extracted = GenericItemExtractor.extract(item, BASE, SOURCE);

        assertThat(extracted).isPresent();
        Result result = extracted.get();
        assertThat(result.title()).isEqualTo("Sunset at the beach");
        assertThat(result.url()).isEqualTo("https://tube.example.com/video/123/sunset");
        assertThat(result.thumbnail()).isEqualTo("https://cdn.example.com/t/123.jpg");
        assertThat(result.previewUrl()).isEqualTo("https://tube.example.com/p/123.mp4");
        assertThat(result.duration()).isEqualTo("10:05");
        assertThat(result.durationSeconds()).isEqualTo(605);
        assertThat(result.views()).isEqualTo("1.5M views");
        assertThat(result.viewsCount()).isEqualTo(1_500_000L);
        assertThat(result.rating()).isEqualTo(91.0);
        assertThat(result.quality()).isEqualTo("1080p");
        assertThat(result.tags()).containsExactly("sunset", "outdoor", "beach");
        assertThat(result.performer()).isEqualTo("Jane Roe");
        assertThat(result.source()).isEqualTo("example");
        assertThat(result.sourceDisplay()).isEqualTo("Example Tube");
        assertThat(result.id()).hasSize(16);
    }

    @Test
    void fallsBackToImageAltForTitle() {
        Element item = card("""
                <div class="item"><a href="video/9"><img src="/t/9.jpg" alt="Alt title"></a></div>
                """);

        Result result = GenericItemExtractor.extract(item, BASE, SOURCE).orElseThrow();

        assertThat(result.title()).isEqualTo("Alt title");
        assertThat(result.url()).isEqualTo("https://tube.example.com/video/9");
        assertThat(result.thumbnail()).isEqualTo("https://tube.example.com/t/9.jpg");
    }

    @Test
    void cardThatIsItselfALinkUsesItsText() {
        Element item = card("<a class=\"th\" href=\"https://tube.example.com/v/7\">Plain link title</a>");

        Result result = GenericItemExtractor.extract(item, BASE, SOURCE).orElseThrow();

        assertThat(result.title()).isEqualTo("Plain link title");
        assertThat(result.duration()).isNull();
        assertThat(result.durationSeconds()).isZero();
    }

    @Test
    void skipsCardsWithoutLinkOrTitle() {
        assertThat(GenericItemExtractor.extract(card("<div><span>No link</span></div>"), BASE, SOURCE)).isEmpty();
        assertThat(GenericItemExtractor.extract(card("<div><a href=\"/v/1\"></a></div>"), BASE, SOURCE)).isEmpty();
        assertThat(GenericItemExtractor.extract(card("<div><a href=\" \">Title</a></div>"), BASE, SOURCE)).isEmpty();
    }

    @Test
    void durationIsReadFromDataAttributeFirst() {
        Element item = card("<div><span class=\"duration\" data-duration=\"125\">bogus</span></div>");

        assertThat(GenericItemExtractor.extractDuration(item).seconds()).isEqualTo(125);
    }

    @Test
    void qualityFallsBackToBadgeClass() {
        Element item = card("<div><i class=\"icon-4k\"></i></div>");

        assertThat(GenericItemExtractor.extractQuality(item)).isEqualTo("4K");
    }
}
