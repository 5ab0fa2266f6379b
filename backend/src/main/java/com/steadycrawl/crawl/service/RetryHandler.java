package com.steadycrawl.crawl.service;

import com.steadycrawl.crawl.model.FailedTask;

/**
 * Re-runs one deferred work item. Returning normally resolves the task; anything thrown counts as a failed
 * attempt, except {@link com.steadycrawl.crawl.http.CircuitOpenException} which leaves it for a later pass.
 */
@FunctionalInterface
public interface RetryHandler {
    void retry(FailedTask task);
}
