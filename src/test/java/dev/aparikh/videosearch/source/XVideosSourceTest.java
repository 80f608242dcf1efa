package dev.aparikh.videosearch.source;

import dev.aparikh.videosearch.model.Result;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class XVideosSourceTest {

    private final XVideosSource source = new XVideosSource(new SourceFetcher(Fixtures.FAST_POLICY));

    @Test
    void parsesThumbBlocksOnce() {
        String html = """
                <div class="mozaique">
                  <div class="thumb-block">
                    <div class="thumb-inside">
                      <div class="thumb" data-preview="https://img.xvideos-cdn.com/p/1.mp4">
                        <a href="/video12345/night_drive"><img data-src="https://img.xvideos-cdn.com/t/1.jpg"></a>
                      </div>
                    </div>
                    <p class="title"><a href="/video12345/night_drive" title="Night drive">Night drive</a></p>
                    <p class="metadata"><span class="duration">7 min</span><span class="views">2.1k</span></p>
                  </div>
                  <div class="thumb-block">
                    <div class="thumb"><a href="/premium/video999"><img src="x.jpg"></a></div>
                    <p class="title"><a href="/premium/video999" title="Locked">Locked</a></p>
                  </div>
                </div>
                """;

        List<Result> results = source.parse(html);

        assertThat(results).hasSize(1);
        Result result = results.get(0);
        assertThat(result.title()).isEqualTo("Night drive");
        assertThat(result.url()).isEqualTo("https://www.xvideos.com/video12345/night_drive");
        assertThat(result.thumbnail()).isEqualTo("https://img.xvideos-cdn.com/t/1.jpg");
        assertThat(result.previewUrl()).isEqualTo("https://img.xvideos-cdn.com/p/1.mp4");
        assertThat(result.durationSeconds()).isEqualTo(420);
        assertThat(result.viewsCount()).isEqualTo(2_100L);
    }

    @Test
    void pagesAreZeroBasedOnTheSite() {
        assertThat(source.searchUrl("night drive", 1)).isEqualTo("https://www.xvideos.com/?k=night+drive&p=0");
    }
}
