package com.steadycrawl.crawl;

import com.steadycrawl.crawl.service.CrawlResilienceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ResilienceApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private CrawlResilienceService resilienceService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void statsStartEmpty() throws Exception {
        mockMvc.perform(get("/api/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.circuitState").value("CLOSED"))
            .andExpect(jsonPath("$.activeConcurrency").value(0));
    }

    @Test
    void checkpointIsVisibleAndClearable() throws Exception {
        resilienceService.saveCheckpoint("SMOKE_LIST", 5, 120, Map.of("seriesId", "s-1"));

        mockMvc.perform(get("/api/checkpoints/SMOKE_LIST"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.currentPage").value(5))
            .andExpect(jsonPath("$.totalProcessed").value(120))
            .andExpect(jsonPath("$.metadata.seriesId").value("s-1"));

        mockMvc.perform(delete("/api/checkpoints/SMOKE_LIST"))
            .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/checkpoints/SMOKE_LIST"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void failedTaskShowsUpButIsNotDueYet() throws Exception {
        String taskId = resilienceService.addFailedTask("SMOKE_DETAIL", "https://example.org/detail/1", "HTTP 503");

        mockMvc.perform(get("/api/failed-tasks"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.taskId == '" + taskId + "')].status").value("PENDING"));

        mockMvc.perform(get("/api/failed-tasks/due"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.taskId == '" + taskId + "')]").isEmpty());
    }

    @Test
    void requeueOfUnknownTaskIsNotFound() throws Exception {
        mockMvc.perform(post("/api/failed-tasks/UNKNOWN_000000000000/requeue"))
            .andExpect(status().isNotFound());
    }

    @Test
    void schedulerIsIdleInTestsAndCanRunAPass() throws Exception {
        mockMvc.perform(get("/api/retry-scheduler/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(false));

        mockMvc.perform(post("/api/retry-scheduler/run"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.dispatched").value(0));
    }

    @Test
    void runsEndpointListsCollectionRuns() throws Exception {
        resilienceService.startRun("SMOKE_LIST");

        mockMvc.perform(get("/api/runs"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray())
            .andExpect(jsonPath("$[0].taskType").value("SMOKE_LIST"));
    }
}
