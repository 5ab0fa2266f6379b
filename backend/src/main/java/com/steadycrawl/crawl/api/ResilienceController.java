package com.steadycrawl.crawl.api;

import com.steadycrawl.crawl.model.CollectionState;
import com.steadycrawl.crawl.model.FailedTask;
import com.steadycrawl.crawl.model.FetchStatsSnapshot;
import com.steadycrawl.crawl.model.ResumePoint;
import com.steadycrawl.crawl.model.RetryPassSummary;
import com.steadycrawl.crawl.model.RetrySchedulerStatus;
import com.steadycrawl.crawl.service.CrawlResilienceService;
import com.steadycrawl.crawl.service.UnknownTaskException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class ResilienceController {
    private final CrawlResilienceService resilienceService;

    public ResilienceController(CrawlResilienceService resilienceService) {
        this.resilienceService = resilienceService;
    }

    @GetMapping("/stats")
    public FetchStatsSnapshot stats() {
        return resilienceService.stats();
    }

    @GetMapping("/checkpoints")
    public Map<String, ResumePoint> checkpoints() {
        return resilienceService.checkpoints();
    }

    @GetMapping("/checkpoints/{taskType}")
    public ResumePoint checkpoint(@PathVariable("taskType") String taskType) {
        return resilienceService.loadCheckpoint(taskType)
            .orElseThrow(() -> new UnknownTaskException("No resume point for task type " + taskType));
    }

    @DeleteMapping("/checkpoints/{taskType}")
    public ResponseEntity<Void> clearCheckpoint(@PathVariable("taskType") String taskType) {
        resilienceService.clearCheckpoint(taskType);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/failed-tasks")
    public List<FailedTask> failedTasks() {
        return resilienceService.failedTasks();
    }

    @GetMapping("/failed-tasks/due")
    public List<FailedTask> dueTasks() {
        return resilienceService.dueTasks();
    }

    @PostMapping("/failed-tasks/{taskId}/requeue")
    public FailedTask requeue(@PathVariable("taskId") String taskId) {
        return resilienceService.requeueFailedTask(taskId);
    }

    @GetMapping("/retry-scheduler/status")
    public RetrySchedulerStatus schedulerStatus() {
        return resilienceService.retrySchedulerStatus();
    }

    @PostMapping("/retry-scheduler/start")
    public RetrySchedulerStatus startScheduler() {
        return resilienceService.startRetryScheduler();
    }

    @PostMapping("/retry-scheduler/stop")
    public RetrySchedulerStatus stopScheduler() {
        return resilienceService.stopRetryScheduler();
    }

    @PostMapping("/retry-scheduler/run")
    public RetryPassSummary runScheduler() {
        return resilienceService.runRetryPass();
    }

    @GetMapping("/runs")
    public List<CollectionState> runs() {
        return resilienceService.runs();
    }
}
