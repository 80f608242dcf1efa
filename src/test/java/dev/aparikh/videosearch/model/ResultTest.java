package dev.aparikh.videosearch.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultTest {

    private static final SourceDescriptor SOURCE = new SourceDescriptor(
            "redtube", "RedTube", "https://www.redtube.com", 1, Set.of(Capability.DURATION), null, null);

    @Test
    void builderProducesNormalizedResult() {
        Result result = Result.builder()
                .title("  Sunset walk  ")
                .url(" https://www.redtube.com/123 ")
                .thumbnail("")
                .duration("10:05", 605)
                .views("3.4K", 3400)
                .rating(87)
                .tags(List.of("Outdoor", "outdoor", "x", "Beach"))
                .source(SOURCE)
                .build()
                .orElseThrow();

        assertThat(result.title()).isEqualTo("Sunset walk");
        assertThat(result.url()).isEqualTo("https://www.redtube.com/123");
        assertThat(result.thumbnail()).isNull();
        assertThat(result.durationSeconds()).isEqualTo(605);
        assertThat(result.rating()).isEqualTo(87.0);
        assertThat(result.tags()).containsExactly("outdoor", "beach");
        assertThat(result.source()).isEqualTo("redtube");
        assertThat(result.sourceDisplay()).isEqualTo("RedTube");
    }

    @Test
    void idIsSixteenHexCharactersAndDeterministic() {
        String id = Result.generateId("https://www.redtube.com/123", "redtube");

        assertThat(id).hasSize(16).matches("[0-9a-f]{16}");
        assertThat(Result.generateId("https://www.redtube.com/123", "redtube")).isEqualTo(id);
        assertThat(Result.generateId("https://www.redtube.com/123", "pornhub")).isNotEqualTo(id);
    }

    @Test
    void builderRejectsMissingTitleOrUrl() {
        assertThat(Result.builder().url("https://x.test/1").source(SOURCE).build()).isEmpty();
        assertThat(Result.builder().title("   ").url("https://x.test/1").source(SOURCE).build()).isEmpty();
        assertThat(Result.builder().title("Title").source(SOURCE).build()).isEmpty();
    }

    @Test
    void constructorEnforcesNonBlankFields() {
        assertThatThrownBy(() -> new Result("id", " ", "https://x.test", null, null, null, null, 0, null, 0,
                null, null, null, null, null, "s", "S"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withMediaReplacesOnlyMediaUrls() {
        Result result = Result.builder().title("T").url("https://x.test/1").thumbnail("https://cdn/t.jpg")
                .previewUrl("https://cdn/p.mp4").source(SOURCE).build().orElseThrow();

        Result mapped = result.withMedia("/img/t", "/img/p");

        assertThat(mapped.thumbnail()).isEqualTo("/img/t");
        assertThat(mapped.previewUrl()).isEqualTo("/img/p");
        assertThat(mapped.id()).isEqualTo(result.id());
        assertThat(mapped.title()).isEqualTo("T");
    }

    @Test
    void descriptorDefaultsDisplayNameAndExtraction() {
        SourceDescriptor descriptor = new SourceDescriptor("fux", null, "https://www.fux.com", 2, null, null, null);

        assertThat(descriptor.displayName()).isEqualTo("fux");
        assertThat(descriptor.extractionMethod()).isEqualTo(ExtractionMethod.HTML);
        assertThat(descriptor.capabilities()).isEmpty();
        assertThatThrownBy(() -> new SourceDescriptor("x", "X", "https://x.test", 0, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
