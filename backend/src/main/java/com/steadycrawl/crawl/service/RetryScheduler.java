package com.steadycrawl.crawl.service;

import com.steadycrawl.config.CrawlerProperties;
import com.steadycrawl.crawl.http.CircuitOpenException;
import com.steadycrawl.crawl.http.FetchMiddleware;
import com.steadycrawl.crawl.model.FailedTask;
import com.steadycrawl.crawl.model.FailedTaskStatus;
import com.steadycrawl.crawl.model.FetchRequest;
import com.steadycrawl.crawl.model.RetryPassSummary;
import com.steadycrawl.crawl.model.RetrySchedulerStatus;
import com.steadycrawl.crawl.persistence.FailedTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background loop that drains due failed tasks back through their retry handlers, at most
 * {@code maxWorkers} at a time.
 */
@Service
public class RetryScheduler {
    private static final Logger log = LoggerFactory.getLogger(RetryScheduler.class);

    static final String METHOD_KEY = "method";
    static final String PAYLOAD_KEY = "payload";
    static final String HEADERS_KEY = "headers";

    private enum Outcome {
        RESOLVED,
        RESCHEDULED,
        EXHAUSTED,
        CIRCUIT_OPEN,
        SKIPPED
    }

    private final FailedTaskQueue queue;
    private final RetryHandler defaultHandler;
    private final CrawlerProperties properties;
    private final Clock clock;
    private final Map<String, RetryHandler> handlers = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Object lifecycleLock = new Object();
    private final Object passLock = new Object();
    private final Object wakeSignal = new Object();

    private volatile boolean stopRequested;
    private volatile RetryPassSummary lastPass;
    private volatile ExecutorService workerPool;
    private Thread loopThread;

    public RetryScheduler(
        FailedTaskQueue queue,
        FetchMiddleware fetchMiddleware,
        CrawlerProperties properties,
        Clock clock
    ) {
        this.queue = queue;
        this.defaultHandler = task -> fetchMiddleware.request(replayRequest(task));
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void registerHandler(String taskType, RetryHandler handler) {
        handlers.put(taskType, handler);
        log.info("Registered retry handler for {}", taskType);
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            stopRequested = false;
            workerPool = newWorkerPool(properties.getScheduler().getMaxWorkers());
            Thread thread = new Thread(this::loop, "retry-scheduler");
            thread.setDaemon(true);
            loopThread = thread;
            running.set(true);
            thread.start();
            log.info("Retry scheduler started, checking every {}s with {} worker(s)",
                properties.getScheduler().getCheckIntervalSeconds(), properties.getScheduler().getMaxWorkers());
        }
    }

    /**
     * Signals the loop to stop and waits, up to the configured stop timeout, for in-flight retries to finish.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            stopRequested = true;
            synchronized (wakeSignal) {
                wakeSignal.notifyAll();
            }
            Duration stopTimeout = Duration.ofSeconds(properties.getScheduler().getStopTimeoutSeconds());
            ExecutorService pool = workerPool;
            workerPool = null;
            try {
                loopThread.join(stopTimeout.toMillis());
                if (loopThread.isAlive()) {
                    log.warn("Retry scheduler did not stop within {}s, interrupting {} in-flight retries",
                        stopTimeout.toSeconds(), inFlight.get());
                    loopThread.interrupt();
                    abort(pool);
                } else {
                    pool.shutdown();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                loopThread.interrupt();
                abort(pool);
            }
            loopThread = null;
            running.set(false);
            stopRequested = false;
            log.info("Retry scheduler stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public RetrySchedulerStatus status() {
        RetryPassSummary pass = lastPass;
        return new RetrySchedulerStatus(
            running.get(),
            inFlight.get(),
            queue.dueTasks().size(),
            queue.exhaustedTasks().size(),
            pass == null ? null : pass.finishedAt(),
            pass
        );
    }

    /**
     * Runs one pass synchronously over the tasks due now. A stopped scheduler runs the pass on a pool that
     * lives only for this call.
     */
    public RetryPassSummary runOnce() {
        synchronized (passLock) {
            Instant startedAt = clock.instant();
            List<FailedTask> due = queue.dueTasks();
            if (due.isEmpty()) {
                RetryPassSummary summary = RetryPassSummary.empty(startedAt);
                lastPass = summary;
                return summary;
            }

            ExecutorService pool = workerPool;
            boolean passPool = pool == null;
            if (passPool) {
                pool = newWorkerPool(Math.min(properties.getScheduler().getMaxWorkers(), due.size()));
            }
            Map<Outcome, Integer> outcomes = new EnumMap<>(Outcome.class);
            try {
                List<FailedTask> submitted = new ArrayList<>(due.size());
                List<Future<Outcome>> futures = new ArrayList<>(due.size());
                for (FailedTask task : due) {
                    try {
                        futures.add(pool.submit(() -> retryTask(task)));
                        submitted.add(task);
                    } catch (RejectedExecutionException e) {
                        log.debug("Worker pool closed, leaving {} task(s) for a later pass", due.size() - submitted.size());
                        break;
                    }
                }
                for (int i = 0; i < futures.size(); i++) {
                    Outcome outcome;
                    try {
                        outcome = futures.get(i).get();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        futures.subList(i, futures.size()).forEach(future -> future.cancel(true));
                        break;
                    } catch (CancellationException e) {
                        outcome = Outcome.SKIPPED;
                    } catch (ExecutionException e) {
                        FailedTask task = submitted.get(i);
                        log.warn("Retry worker failed on {}", task.taskId(), e.getCause());
                        outcome = recordFailure(task, e.getCause());
                    }
                    outcomes.merge(outcome, 1, Integer::sum);
                }
            } finally {
                if (passPool) {
                    pool.shutdown();
                }
            }

            int skipped = outcomes.getOrDefault(Outcome.SKIPPED, 0);
            int total = outcomes.values().stream().mapToInt(Integer::intValue).sum();
            RetryPassSummary summary = new RetryPassSummary(
                startedAt,
                clock.instant(),
                total - skipped,
                outcomes.getOrDefault(Outcome.RESOLVED, 0),
                outcomes.getOrDefault(Outcome.RESCHEDULED, 0),
                outcomes.getOrDefault(Outcome.EXHAUSTED, 0),
                outcomes.getOrDefault(Outcome.CIRCUIT_OPEN, 0)
            );
            lastPass = summary;
            log.info("Retry pass: dispatched={} resolved={} rescheduled={} exhausted={} circuitOpen={}",
                summary.dispatched(), summary.resolved(), summary.rescheduled(), summary.exhausted(),
                summary.skippedCircuitOpen());
            return summary;
        }
    }

    /**
     * Rebuilds the request a deferred fetch was made with. Tasks queued without request details replay as
     * {@code GET target}.
     */
    static FetchRequest replayRequest(FailedTask task) {
        Map<String, Object> metadata = task.metadata();
        Object method = metadata.get(METHOD_KEY);
        Object payload = metadata.get(PAYLOAD_KEY);
        Map<String, String> headers = new LinkedHashMap<>();
        if (metadata.get(HEADERS_KEY) instanceof Map<?, ?> recorded) {
            recorded.forEach((name, value) -> {
                if (name != null && value != null) {
                    headers.put(name.toString(), value.toString());
                }
            });
        }
        return new FetchRequest(
            method == null ? null : method.toString(),
            task.target(),
            payload == null ? null : payload.toString(),
            headers
        );
    }

    private Outcome retryTask(FailedTask task) {
        if (stopRequested) {
            return Outcome.SKIPPED;
        }
        RetryHandler handler = handlers.getOrDefault(task.taskType(), defaultHandler);
        inFlight.incrementAndGet();
        try {
            handler.retry(task);
        } catch (CircuitOpenException e) {
            log.debug("Retry of {} deferred, circuit {} open until {}", task.taskId(), e.target(), e.retryAfter());
            return Outcome.CIRCUIT_OPEN;
        } catch (RuntimeException e) {
            return recordFailure(task, e);
        } finally {
            inFlight.decrementAndGet();
        }
        queue.markResolved(task.taskId());
        return Outcome.RESOLVED;
    }

    private Outcome recordFailure(FailedTask task, Throwable error) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        Optional<FailedTask> updated = queue.markFailed(task.taskId(), message);
        return updated.map(value -> value.status() == FailedTaskStatus.EXHAUSTED
            ? Outcome.EXHAUSTED
            : Outcome.RESCHEDULED).orElse(Outcome.SKIPPED);
    }

    private ExecutorService newWorkerPool(int workers) {
        return Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("retry-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    private static void abort(ExecutorService pool) {
        for (Runnable pending : pool.shutdownNow()) {
            if (pending instanceof Future<?> future) {
                future.cancel(false);
            }
        }
    }

    private void loop() {
        long intervalMs = Duration.ofSeconds(properties.getScheduler().getCheckIntervalSeconds()).toMillis();
        while (!stopRequested && !Thread.currentThread().isInterrupted()) {
            try {
                runOnce();
            } catch (RuntimeException e) {
                log.warn("Retry pass failed", e);
            }
            synchronized (wakeSignal) {
                if (stopRequested) {
                    break;
                }
                try {
                    wakeSignal.wait(intervalMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }
}
