package com.steadycrawl.crawl.model;

import java.time.Instant;

public record RetrySchedulerStatus(
    boolean running,
    int inFlight,
    int dueTasks,
    int exhaustedTasks,
    Instant lastPassAt,
    RetryPassSummary lastPass
) {
}
