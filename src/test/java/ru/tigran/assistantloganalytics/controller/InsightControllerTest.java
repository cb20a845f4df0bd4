package ru.tigran.assistantloganalytics.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import reactor.core.publisher.Mono;
import ru.tigran.assistantloganalytics.dto.InsightResponse;
import ru.tigran.assistantloganalytics.ingestion.LogSnapshotStore;
import ru.tigran.assistantloganalytics.model.LogSnapshot;
import ru.tigran.assistantloganalytics.service.LogInsightService;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(InsightController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("InsightController модульные тесты")
class InsightControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LogInsightService logInsightService;

    @MockBean
    private LogSnapshotStore snapshotStore;

    @Test
    @DisplayName("GET /insights - асинхронный ответ с HTML анализом")
    void getInsight() throws Exception {
        LogSnapshot snapshot = new LogSnapshot("snap-1", "logs.csv", Instant.now(), 0, List.of());
        when(snapshotStore.require()).thenReturn(snapshot);
        when(logInsightService.generateInsight(snapshot))
                .thenReturn(Mono.just(new InsightResponse("snap-1", 42, "<h3>热点</h3>", true)));

        MvcResult pending = mockMvc.perform(get("/api/v1/insights"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.snapshotId", equalTo("snap-1")))
                .andExpect(jsonPath("$.sampleSize", equalTo(42)))
                .andExpect(jsonPath("$.html", equalTo("<h3>热点</h3>")))
                .andExpect(jsonPath("$.successful", equalTo(true)));
    }

    @Test
    @DisplayName("GET /insights - ошибка провайдера приходит в теле с successful=false")
    void getInsightFailureMarkup() throws Exception {
        LogSnapshot snapshot = new LogSnapshot("snap-1", "logs.csv", Instant.now(), 0, List.of());
        when(snapshotStore.require()).thenReturn(snapshot);
        when(logInsightService.generateInsight(snapshot))
                .thenReturn(Mono.just(new InsightResponse("snap-1", 0, "<p class='text-red-500'>error</p>", false)));

        MvcResult pending = mockMvc.perform(get("/api/v1/insights"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.successful", equalTo(false)));
    }
}
