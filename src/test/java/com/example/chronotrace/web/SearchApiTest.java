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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = WebFixtures.DATASOURCE)
@AutoConfigureMockMvc
@ActiveProfiles("exact-index")
public class SearchApiTest {

    private static final Instant START = Instant.parse("2024-05-01T09:00:00Z");

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper mapper;

    private JsonNode search(Map<String, Object> body) throws Exception {
        String json = mvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(mapper.writeValueAsString(body)))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return mapper.readTree(json);
    }

    @Test
    public void indexedSegmentsAreFoundByCameraAndServedFromCacheOnRepeat() throws Exception {
        List<Map<String, Object>> segments = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            segments.add(WebFixtures.segment("lobby-" + i, "vid-lobby", "CAM-1", i, START, "lobby footage block " + i));
        }
        for (int i = 0; i < 4; i++) {
            segments.add(WebFixtures.segment("street-" + i, "vid-street", "CAM-2", i, START, "street footage block " + i));
        }
        mvc.perform(post("/api/segments/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(mapper.writeValueAsString(Map.of("segments", segments))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(12));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", "person in red jacket");
        body.put("filters", Map.of("cameraId", "CAM-1"));
        body.put("topK", 10);
        body.put("scoreThreshold", 0.0);

        JsonNode first = search(body);
        assertThat(first.get("cacheHit").asBoolean()).isFalse();
        JsonNode results = first.get("results");
        assertThat(results.size()).isEqualTo(8);
        double previous = Double.MAX_VALUE;
        for (JsonNode hit : results) {
            assertThat(hit.get("cameraId").asText()).isEqualTo("CAM-1");
            assertThat(hit.get("videoId").asText()).isEqualTo("vid-lobby");
            assertThat(hit.get("duration").asDouble()).isEqualTo(15.0);
            double score = hit.get("score").asDouble();
            assertThat(score).isGreaterThanOrEqualTo(0.0).isLessThanOrEqualTo(previous);
            previous = score;
        }

        JsonNode second = search(body);
        assertThat(second.get("cacheHit").asBoolean()).isTrue();
        assertThat(second.get("results")).isEqualTo(results);
        assertThat(second.get("queryId").asText()).isNotEqualTo(first.get("queryId").asText());
    }

    @Test
    public void timeRangeFilterIsInclusive() throws Exception {
        List<Map<String, Object>> segments = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            segments.add(WebFixtures.segment("dock-" + i, "vid-dock", "CAM-7", i, START, "dock footage " + i));
        }
        mvc.perform(post("/api/segments/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(mapper.writeValueAsString(Map.of("segments", segments))))
                .andExpect(status().isOk());

        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("cameraId", "CAM-7");
        filters.put("from", START.plusSeconds(15).toString());
        filters.put("to", START.plusSeconds(30).toString());
        JsonNode r = search(Map.of("query", "truck at the dock", "filters", filters, "scoreThreshold", -1.0));

        List<String> ids = new ArrayList<>();
        r.get("results").forEach(h -> ids.add(h.get("segmentId").asText()));
        assertThat(ids).containsExactlyInAnyOrder("dock-1", "dock-2");
    }

    @Test
    public void invalidSearchesAreBadRequests() throws Exception {
        mvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("FILTER_VALIDATION"));

        mvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"x\",\"topK\":0}"))
                .andExpect(status().isBadRequest());

        mvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"x\",\"filters\":{\"from\":\"2024-05-02T00:00:00Z\",\"to\":\"2024-05-01T00:00:00Z\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("FILTER_VALIDATION"));

        mvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }
}
