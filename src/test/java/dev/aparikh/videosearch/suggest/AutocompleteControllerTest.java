package dev.aparikh.videosearch.suggest;

import dev.aparikh.videosearch.query.BangInfo;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = AutocompleteController.class)
class AutocompleteControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SuggestionService suggestionService;

    @Test
    void listBangsAsJson() throws Exception {
        when(suggestionService.allBangs()).thenReturn(List.of(
                new BangInfo("!pornhub", "pornhub", "PornHub", "!ph", List.of("!ph", "!pornhub"))));

        mockMvc.perform(get("/api/v1/bangs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].bang").value("!pornhub"))
                .andExpect(jsonPath("$[0].shortCode").value("!ph"))
                .andExpect(jsonPath("$[0].aliases.length()").value(2));
    }

    @Test
    void listBangsAsPlainText() throws Exception {
        when(suggestionService.allBangs()).thenReturn(List.of(
                new BangInfo("!pornhub", "pornhub", "PornHub", "!ph", List.of("!ph", "!pornhub")),
                new BangInfo("!xvideos", "xvideos", "XVideos", "!xv", List.of("!xv", "!xvideos"))));

        mockMvc.perform(get("/api/v1/bangs").accept(MediaType.TEXT_PLAIN))
                .andExpect(status().isOk())
                .andExpect(content().string("bangs: 2\n---\n!pornhub - pornhub\n!xvideos - xvideos\n"));
    }

    @Test
    void autocompleteBangCarriesScorelessItems() throws Exception {
        when(suggestionService.autocomplete("cats !ph")).thenReturn(new AutocompleteResponse(
                AutocompleteResponse.BANG,
                List.of(new BangSuggestion("!pornhub", "pornhub", "PornHub", "!ph", 298)),
                "!ph"));

        mockMvc.perform(get("/api/v1/autocomplete").param("q", "cats !ph"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("bang"))
                .andExpect(jsonPath("$.replace").value("!ph"))
                .andExpect(jsonPath("$.suggestions[0].engineName").value("pornhub"))
                .andExpect(jsonPath("$.suggestions[0].score").doesNotExist());
    }

    @Test
    void autocompleteWithoutInputReturnsPopular() throws Exception {
        when(suggestionService.autocomplete(null)).thenReturn(new AutocompleteResponse(
                AutocompleteResponse.POPULAR, List.of("teen", "milf"), null));

        mockMvc.perform(get("/api/v1/autocomplete"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("popular"))
                .andExpect(jsonPath("$.suggestions[1]").value("milf"))
                .andExpect(jsonPath("$.replace").doesNotExist());
    }

    @Test
    void autocompleteAsPlainText() throws Exception {
        when(suggestionService.autocomplete("cats @ja")).thenReturn(new AutocompleteResponse(
                AutocompleteResponse.PERFORMER,
                List.of(new PerformerSuggestion("Janet", 295), new PerformerSuggestion("Jane Doe", 292)),
                "@ja"));

        mockMvc.perform(get("/api/v1/autocomplete").param("q", "cats @ja").accept(MediaType.TEXT_PLAIN))
                .andExpect(status().isOk())
                .andExpect(content().string(
                        "type: performer\nreplace: @ja\nsuggestions: 2\n---\nJanet\nJane Doe\n"));
    }
}
