package com.powerguard.dispatch.api;

import com.powerguard.core.history.HistoryProperties;
import com.powerguard.core.history.OutcomeEntry;
import com.powerguard.core.history.OutcomeRecorder;
import com.powerguard.core.model.ExecutionResult;
import com.powerguard.core.model.ExecutionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HistoryController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HistoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OutcomeRecorder recorder;

    @MockitoBean
    private HistoryProperties properties;

    @BeforeEach
    void setUp() {
        when(properties.zoneId()).thenReturn(ZoneOffset.UTC);
    }

    private static OutcomeEntry entry(long sequence, String id, String at) {
        Instant instant = Instant.parse(at);
        return new OutcomeEntry(sequence, "PG-1", new ExecutionResult(id, ExecutionStatus.SUCCESS, "ok", instant), instant);
    }

    @Test
    @DisplayName("GET /history returns recent entries newest first")
    void recent() throws Exception {
        when(recorder.recent(50)).thenReturn(List.of(
                entry(2, "b", "2026-03-02T09:00:00Z"),
                entry(1, "a", "2026-03-01T09:00:00Z")));

        mockMvc.perform(get("/api/v1/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].batch_id").value("PG-1"))
                .andExpect(jsonPath("$[0].result.actionable_id").value("b"));
    }

    @Test
    @DisplayName("GET /history?group=day groups by date")
    void groupedByDay() throws Exception {
        when(recorder.recent(10)).thenReturn(List.of(
                entry(3, "c", "2026-03-02T11:00:00Z"),
                entry(2, "b", "2026-03-02T09:00:00Z"),
                entry(1, "a", "2026-03-01T09:00:00Z")));

        mockMvc.perform(get("/api/v1/history").param("limit", "10").param("group", "day"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['2026-03-02']", hasSize(2)))
                .andExpect(jsonPath("$['2026-03-01']", hasSize(1)));
    }

    @Test
    @DisplayName("GET /history?group=hour groups by hour")
    void groupedByHour() throws Exception {
        when(recorder.recent(50)).thenReturn(List.of(
                entry(2, "b", "2026-03-02T09:45:00Z"),
                entry(1, "a", "2026-03-02T09:05:00Z")));

        mockMvc.perform(get("/api/v1/history").param("group", "HOUR"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['2026-03-02T09:00']", hasSize(2)));
    }

    @Test
    @DisplayName("GET /history rejects an out-of-range limit or unknown grouping")
    void badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/history").param("limit", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/history").param("limit", "5000"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/history").param("group", "week"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("none, day, hour")));

        verify(recorder, never()).recent(anyInt());
    }
}
