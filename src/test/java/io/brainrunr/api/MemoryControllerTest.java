package io.brainrunr.api;

import io.brainrunr.consolidation.ConsolidationStats;
import io.brainrunr.episode.EpisodeManager;
import io.brainrunr.graph.DivergentDiagnostics;
import io.brainrunr.memory.Emotion;
import io.brainrunr.memory.MemoryCategory;
import io.brainrunr.memory.MemoryRecord;
import io.brainrunr.memory.MemoryService;
import io.brainrunr.memory.NotFoundException;
import io.brainrunr.memory.StoreIOException;
import io.brainrunr.memory.ValidationException;
import io.brainrunr.search.ScoredMemory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MemoryController.class)
class MemoryControllerTest {

    private static final MemoryRecord SUNSET = new MemoryRecord("m1", "sunset over the bay", new float[]{1f, 0f},
            Emotion.MOVED, MemoryCategory.OBSERVATION, 4, Instant.parse("2026-01-01T00:00:00Z"), null, 0,
            null, null, null, List.of("sky"));

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MemoryService memoryService;

    @MockBean
    private EpisodeManager episodeManager;

    @Test
    void shouldReturnHealthStatus() throws Exception {
        when(memoryService.healthCheck()).thenReturn(true);

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.service").value("brainrunr"));
    }

    @Test
    void shouldReportUnavailableStore() throws Exception {
        when(memoryService.healthCheck()).thenReturn(false);

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("unavailable"));
    }

    @Test
    void shouldCreateMemory() throws Exception {
        when(memoryService.remember(eq("sunset over the bay"), eq(Emotion.MOVED), eq(MemoryCategory.OBSERVATION),
                eq(4), any(), any(), any())).thenReturn(SUNSET);

        mockMvc.perform(post("/api/memories")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"content": "sunset over the bay", "emotion": "moved", "category": "observation",
                                 "importance": 4, "tags": ["sky"]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("m1"))
                .andExpect(jsonPath("$.emotion").value("moved"))
                .andExpect(jsonPath("$.tags[0]").value("sky"))
                .andExpect(jsonPath("$.embedding").doesNotExist());
    }

    @Test
    void shouldRejectInvalidMemory() throws Exception {
        when(memoryService.remember(any(), any(), any(), anyInt(), any(), any(), any()))
                .thenThrow(new ValidationException("Memory content is required"));

        mockMvc.perform(post("/api/memories")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION"))
                .andExpect(jsonPath("$.error").value("Memory content is required"));
    }

    @Test
    void shouldRejectUnknownEmotion() throws Exception {
        mockMvc.perform(post("/api/memories")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"x\", \"emotion\": \"furious\"}"))
                .andExpect(status().isBadRequest());
        verify(memoryService, never()).remember(any(), any(), any(), anyInt(), any(), any(), any());
    }

    @Test
    void shouldRejectMalformedJson() throws Exception {
        mockMvc.perform(post("/api/memories/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION"));
    }

    @Test
    void shouldReturnNotFoundForMissingMemory() throws Exception {
        when(memoryService.get("missing")).thenThrow(NotFoundException.memory("missing"));

        mockMvc.perform(get("/api/memories/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }

    @Test
    void shouldMapStoreFailureToServerError() throws Exception {
        when(memoryService.stats()).thenThrow(new StoreIOException("disk gone", null));

        mockMvc.perform(get("/api/memories/stats"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.kind").value("STORE_IO"));
    }

    @Test
    void shouldSearchMemories() throws Exception {
        when(memoryService.search(eq("sunset"), any(), eq(3)))
                .thenReturn(List.of(new ScoredMemory(SUNSET, 1.0, 1.0, 1.0)));

        mockMvc.perform(post("/api/memories/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"sunset\", \"nResults\": 3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].memory.id").value("m1"))
                .andExpect(jsonPath("$[0].score").value(1.0));
    }

    @Test
    void shouldRequireContextForDiagnostics() throws Exception {
        mockMvc.perform(get("/api/memories/diagnostics"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnDiagnostics() throws Exception {
        when(memoryService.associationDiagnostics("sunset", 20))
                .thenReturn(new DivergentDiagnostics(1, 64, 3, 6, 4, 2.0, 2, 0.7, 4, 3));

        mockMvc.perform(get("/api/memories/diagnostics").param("context", "sunset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stepBudget").value(64))
                .andExpect(jsonPath("$.visitedNodes").value(4));
    }

    @Test
    void shouldConsolidateWithDefaultsWithoutBody() throws Exception {
        when(memoryService.consolidate()).thenReturn(new ConsolidationStats(2, 2, 1, 0, 3));

        mockMvc.perform(post("/api/consolidation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.replayEvents").value(2))
                .andExpect(jsonPath("$.linkUpdates").value(1));
    }

    @Test
    void shouldDeleteMemory() throws Exception {
        mockMvc.perform(delete("/api/memories/m1"))
                .andExpect(status().isNoContent());
        verify(memoryService).delete("m1");
    }

    @Test
    void shouldReturnNotFoundForMissingEpisode() throws Exception {
        doThrow(NotFoundException.episode("e1")).when(episodeManager).delete("e1");

        mockMvc.perform(delete("/api/episodes/e1"))
                .andExpect(status().isNotFound());
    }
}
