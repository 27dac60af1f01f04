package com.example.chronotrace.web;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = WebFixtures.DATASOURCE)
@AutoConfigureMockMvc
@ActiveProfiles("exact-index")
public class AdminControllerSmokeTest {

    @Autowired
    MockMvc mvc;

    @Test
    public void smokeAdminEndpoints() throws Exception {
        mvc.perform(get("/api/admin/index/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind").value("BruteForceVectorIndex"))
                .andExpect(jsonPath("$.size").exists())
                .andExpect(jsonPath("$.queuedForRetry").value(0));

        String rebuild = mvc.perform(post("/api/admin/index/rebuild"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        assertThat(rebuild).contains("rebuild finished");

        mvc.perform(get("/api/admin/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.segmentCache").exists())
                .andExpect(jsonPath("$.queryCache").exists())
                .andExpect(jsonPath("$.searchResults.ttlSeconds").exists());

        mvc.perform(post("/api/admin/cache/search/clear"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("search result cache cleared"));
        mvc.perform(get("/api/admin/cache/stats"))
                .andExpect(jsonPath("$.searchResults.entries").value(0));
    }
}
