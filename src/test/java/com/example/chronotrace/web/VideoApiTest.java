package com.example.chronotrace.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

// own database: list totals count every video in it
@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:chronotrace-videos;DB_CLOSE_DELAY=-1")
@AutoConfigureMockMvc
@ActiveProfiles("exact-index")
public class VideoApiTest {

    private static final Instant START = Instant.parse("2024-05-02T08:00:00Z");

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper mapper;

    private void ingest(List<Map<String, Object>> segments) throws Exception {
        mvc.perform(post("/api/segments/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(mapper.writeValueAsString(Map.of("segments", segments))))
                .andExpect(status().isOk());
    }

    private List<Map<String, Object>> video(String videoId, String camera, int count) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(WebFixtures.segment(videoId + "-" + i, videoId, camera, i, START, videoId + " footage " + i));
        }
        return out;
    }

    private JsonNode searchCamera(String camera) throws Exception {
        String json = mvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(mapper.writeValueAsString(Map.of(
                                "query", "anyone at the gate",
                                "filters", Map.of("cameraId", camera),
                                "scoreThreshold", -1.0))))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return mapper.readTree(json);
    }

    @Test
    public void videosArePagedWithTotalsAndAggregateStatus() throws Exception {
        List<Map<String, Object>> segments = new ArrayList<>();
        segments.addAll(video("v-a", "CAM-A", 3));
        segments.addAll(video("v-b", "CAM-B", 2));
        segments.addAll(video("v-c", "CAM-C", 1));
        // empty content is rejected by the embedding model
        segments.add(WebFixtures.segment("v-c-1", "v-c", "CAM-C", 1, START, ""));
        ingest(segments);

        mvc.perform(get("/api/videos").param("page", "1").param("pageSize", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.page").value(1))
                .andExpect(jsonPath("$.videos.length()").value(2))
                .andExpect(jsonPath("$.videos[0].videoId").value("v-a"))
                .andExpect(jsonPath("$.videos[0].segmentCount").value(3))
                .andExpect(jsonPath("$.videos[0].status").value("INDEXED"))
                .andExpect(jsonPath("$.videos[1].videoId").value("v-b"));

        mvc.perform(get("/api/videos").param("page", "2").param("pageSize", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.videos.length()").value(1))
                .andExpect(jsonPath("$.videos[0].videoId").value("v-c"))
                .andExpect(jsonPath("$.videos[0].indexedCount").value(1))
                .andExpect(jsonPath("$.videos[0].failedCount").value(1))
                .andExpect(jsonPath("$.videos[0].status").value("FAILED"));

        mvc.perform(get("/api/videos").param("status", "FAILED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.videos[0].videoId").value("v-c"));

        mvc.perform(get("/api/videos/v-a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cameraId").value("CAM-A"))
                .andExpect(jsonPath("$.segments.length()").value(3))
                .andExpect(jsonPath("$.segments[2].id").value("v-a-2"))
                .andExpect(jsonPath("$.firstSegmentAt").value(START.toString()))
                .andExpect(jsonPath("$.lastSegmentAt").value(START.plusSeconds(30).toString()));

        mvc.perform(get("/api/videos/v-b/segments"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value("v-b-0"));
    }

    @Test
    public void invalidListParametersAreBadRequests() throws Exception {
        mvc.perform(get("/api/videos").param("status", "SOMEWHAT_INDEXED")).andExpect(status().isBadRequest());
        mvc.perform(get("/api/videos").param("page", "0")).andExpect(status().isBadRequest());
        mvc.perform(get("/api/videos").param("pageSize", "101")).andExpect(status().isBadRequest());
    }

    @Test
    public void unknownVideoIsNotFound() throws Exception {
        mvc.perform(get("/api/videos/no-such-video")).andExpect(status().isNotFound());
        mvc.perform(get("/api/videos/no-such-video/segments")).andExpect(status().isNotFound());
        mvc.perform(delete("/api/videos/no-such-video")).andExpect(status().isNotFound());
    }

    @Test
    public void deletedVideoDisappearsFromCatalogAndSearch() throws Exception {
        ingest(video("v-del", "CAM-DEL", 3));
        assertThat(searchCamera("CAM-DEL").get("results").size()).isEqualTo(3);

        mvc.perform(delete("/api/videos/v-del"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.videoId").value("v-del"))
                .andExpect(jsonPath("$.deletedSegments").value(3));

        mvc.perform(get("/api/videos/v-del")).andExpect(status().isNotFound());
        mvc.perform(get("/api/segments/v-del-0")).andExpect(status().isNotFound());
        JsonNode after = searchCamera("CAM-DEL");
        assertThat(after.get("cacheHit").asBoolean()).isFalse();
        assertThat(after.get("results").size()).isZero();
    }

    @Test
    public void singleSegmentCanBeDeleted() throws Exception {
        ingest(video("v-one", "CAM-ONE", 1));

        mvc.perform(delete("/api/segments/v-one-0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.segmentId").value("v-one-0"))
                .andExpect(jsonPath("$.deleted").value(true));

        mvc.perform(delete("/api/segments/v-one-0")).andExpect(status().isNotFound());
        mvc.perform(get("/api/segments/v-one-0")).andExpect(status().isNotFound());
        mvc.perform(get("/api/videos/v-one")).andExpect(status().isNotFound());
        assertThat(searchCamera("CAM-ONE").get("results").size()).isZero();
    }
}
