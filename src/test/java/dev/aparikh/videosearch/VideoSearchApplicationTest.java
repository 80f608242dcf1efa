package dev.aparikh.videosearch;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.greaterThan;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class VideoSearchApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void enginesAreWiredFromTheCatalog() throws Exception {
        mockMvc.perform(get("/api/v1/engines"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(greaterThan(40)))
                .andExpect(jsonPath("$[0].name").value("pornhub"))
                .andExpect(jsonPath("$[0].enabled").value(true));
    }

    @Test
    void autocompleteUsesTheBundledTables() throws Exception {
        mockMvc.perform(get("/api/v1/autocomplete").param("q", "!ph"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("bang"))
                .andExpect(jsonPath("$.suggestions[0].engineName").value("pornhub"));

        mockMvc.perform(get("/api/v1/autocomplete").param("q", "amat"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.suggestions[0].term").value("amateur"));

        mockMvc.perform(get("/api/v1/autocomplete").param("q", "cats @riley"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("performer"))
                .andExpect(jsonPath("$.suggestions[0].name").value("riley reid"));
    }

    @Test
    void searchValidationHappensBeforeAnyFetch() throws Exception {
        mockMvc.perform(get("/api/v1/search").param("q", "!ph -solo"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("EMPTY_QUERY"));

        mockMvc.perform(get("/api/v1/search").param("q", "cats").param("engines", "nowhere"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("NO_SOURCES"));
    }
}
