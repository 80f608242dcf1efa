package dev.aparikh.videosearch.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.videosearch.config.ConfigurationException;
import dev.aparikh.videosearch.source.FetchPolicy;
import dev.aparikh.videosearch.source.SourceCatalog;
import dev.aparikh.videosearch.source.SourceFetcher;
import dev.aparikh.videosearch.source.SourceRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BangTableTest {

    private static final SourceRegistry REGISTRY = new SourceRegistry(
            SourceCatalog.create(new SourceFetcher(FetchPolicy.defaults()), new ObjectMapper()));

    @Test
    void builtInAliasesResolveCaseInsensitively() {
        BangTable table = BangTable.create(Map.of(), REGISTRY);

        assertThat(table.resolve("ph")).contains("pornhub");
        assertThat(table.resolve("PH")).contains("pornhub");
        assertThat(table.resolve("3m")).contains("3movs");
        assertThat(table.resolve("bogus")).isEmpty();
        assertThat(table.resolve(null)).isEmpty();
    }

    @Test
    void everyBuiltInAliasTargetsARegisteredSource() {
        BangTable table = BangTable.create(Map.of(), REGISTRY);

        assertThat(table.aliases().values()).allSatisfy(source -> assertThat(REGISTRY.contains(source)).isTrue());
    }

    @Test
    void shortCodeIsTheShortestAlias() {
        BangTable table = BangTable.create(Map.of(), REGISTRY);

        assertThat(table.shortCode("pornhub")).contains("ph");
        assertThat(table.shortCode("fux")).contains("fux");
        assertThat(table.shortCode("vporn")).isEmpty();
    }

    @Test
    void entriesListOneRowPerSourceWithPrimaryBang() {
        List<BangInfo> entries = BangTable.create(Map.of(), REGISTRY).entries();

        BangInfo first = entries.get(0);
        assertThat(first.bang()).isEqualTo("!pornhub");
        assertThat(first.engineName()).isEqualTo("pornhub");
        assertThat(first.displayName()).isEqualTo("PornHub");
        assertThat(first.shortCode()).isEqualTo("!ph");
        assertThat(first.aliases()).containsExactly("!ph", "!pornhub");
        assertThat(entries).extracting(BangInfo::engineName).doesNotHaveDuplicates();
    }

    @Test
    void customAliasesExtendAndOverrideBuiltIns() {
        BangTable table = BangTable.create(Map.of("PHX", "pornhub", "xv", "xnxx"), REGISTRY);

        assertThat(table.resolve("phx")).contains("pornhub");
        assertThat(table.resolve("xv")).contains("xnxx");
        assertThat(table.aliasesFor("pornhub")).contains("phx");
    }

    @Test
    void malformedAliasIsAConfigurationError() {
        assertThatThrownBy(() -> BangTable.create(Map.of("p h", "pornhub"), REGISTRY))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("p h");
    }

    @Test
    void aliasForUnknownSourceIsAConfigurationError() {
        assertThatThrownBy(() -> BangTable.create(Map.of("zz", "nowhere"), REGISTRY))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("nowhere");
    }
}
