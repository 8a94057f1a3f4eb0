package org.caureq.caureqsensorhub.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AdminRulesControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void listsShippedRules() throws Exception {
        mockMvc.perform(get("/api/admin/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.defaultCooldownSeconds").value(3600))
                .andExpect(jsonPath("$.rules[?(@.type == 'temperature')].min", hasItem(10.0)))
                .andExpect(jsonPath("$.rules[?(@.type == 'humidity')].max", hasItem(80.0)));
    }

    @Test
    void ruleCanBeAddedAndRemovedAtRuntime() throws Exception {
        mockMvc.perform(put("/api/admin/rules/co2").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\": \"co2\", \"max\": 1000, \"cooldownSeconds\": 60}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.max").value(1000.0))
                .andExpect(jsonPath("$.cooldownSeconds").value(60));

        mockMvc.perform(get("/api/admin/rules"))
                .andExpect(jsonPath("$.rules[?(@.type == 'co2')].max", hasItem(1000.0)));

        mockMvc.perform(delete("/api/admin/rules/co2")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/admin/rules/co2")).andExpect(status().isNotFound());
    }

    @Test
    void invalidRulesAreRejected() throws Exception {
        mockMvc.perform(put("/api/admin/rules/light").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\": \"light\", \"min\": 500, \"max\": 100}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(put("/api/admin/rules/radiation").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\": \"radiation\", \"max\": 1}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(put("/api/admin/rules/light").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\": \"light\", \"cooldownSeconds\": -5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void anomalySettingsRoundTrip() throws Exception {
        mockMvc.perform(put("/api/admin/anomaly").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scoreThreshold\": 3.0, \"minSamples\": 5, \"windowSize\": 50}"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/admin/anomaly"))
                .andExpect(jsonPath("$.scoreThreshold").value(3.0))
                .andExpect(jsonPath("$.minSamples").value(5));

        mockMvc.perform(put("/api/admin/anomaly").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scoreThreshold\": 3.0, \"minSamples\": 80, \"windowSize\": 50}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(put("/api/admin/anomaly").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scoreThreshold\": 0, \"minSamples\": 5, \"windowSize\": 50}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void pipelineViewExposesCounters() throws Exception {
        mockMvc.perform(get("/api/admin/pipeline"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stats.accepting").value(true))
                .andExpect(jsonPath("$.notifier.dropped").value(0))
                .andExpect(jsonPath("$.deadLetters").isArray());
    }
}
