package com.taskq.engine.worker;

import com.taskq.common.model.TaskRecord;
import com.taskq.engine.config.TaskQueueProperties;
import com.taskq.engine.handler.HandlerRegistry;
import com.taskq.engine.handler.TaskOutcome;
import com.taskq.engine.service.QueueEngine;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the configured number of polling threads per queue. Each thread claims a task,
 * hands it to the {@link HandlerRegistry} and records the outcome. In-flight tasks get
 * their lease extended by a heartbeat until they finish.
 */
@Component
public class WorkerPool implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private static final long MIN_HEARTBEAT_MS = 1000;

    private final QueueEngine engine;
    private final HandlerRegistry registry;
    private final TaskQueueProperties properties;
    private final AtomicInteger activeWorkers = new AtomicInteger(0);
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final List<Thread> threads = new ArrayList<>();

    private volatile boolean running;
    private ScheduledExecutorService heartbeat;

    public WorkerPool(QueueEngine engine, HandlerRegistry registry, TaskQueueProperties properties,
                      MeterRegistry meterRegistry) {
        this.engine = engine;
        this.registry = registry;
        this.properties = properties;

        Gauge.builder("taskq_worker_active", activeWorkers, AtomicInteger::get)
                .register(meterRegistry);
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getWorker().isEnabled();
    }

    @Override
    public void start() {
        startWorkers();
    }

    @Override
    public void stop() {
        stopWorkers();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** Starts the threads for every configured queue. Calling it while running has no effect. */
    public synchronized void startWorkers() {
        if (running) {
            return;
        }
        running = true;

        long interval = Math.max(MIN_HEARTBEAT_MS, properties.getLease().getDuration().toMillis() / 3);
        heartbeat = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "lease-heartbeat");
            t.setDaemon(true);
            return t;
        });
        heartbeat.scheduleWithFixedDelay(this::extendLeases, interval, interval, TimeUnit.MILLISECONDS);

        properties.getQueues().forEach((queue, definition) -> {
            for (int i = 0; i < definition.getWorkers(); i++) {
                String workerName = queue + "-worker-" + i;
                Thread thread = new Thread(() -> workerLoop(queue, workerName), workerName);
                thread.setDaemon(true);
                threads.add(thread);
                thread.start();
            }
            log.info("Started {} worker(s) for queue {}", definition.getWorkers(), queue);
        });
    }

    /**
     * Signals every thread to stop after its current task and waits up to the shutdown timeout
     * for each. Tasks still running after that are left to the lease reaper.
     */
    public synchronized void stopWorkers() {
        if (!running) {
            return;
        }
        running = false;

        long timeoutMs = properties.getWorker().getShutdownTimeout().toMillis();
        for (Thread thread : threads) {
            try {
                thread.join(timeoutMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (thread.isAlive()) {
                log.warn("Worker {} did not stop within {}ms", thread.getName(), timeoutMs);
            }
        }
        threads.clear();
        heartbeat.shutdownNow();
        heartbeat = null;
        log.info("Worker pool stopped");
    }

    private void workerLoop(String queue, String workerName) {
        Duration pollInterval = properties.getWorker().getPollInterval();
        Duration errorBackoff = properties.getWorker().getErrorBackoff();

        while (running) {
            try {
                if (!runOnce(queue, workerName)) {
                    Thread.sleep(pollInterval.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                log.error("Worker {} error on queue {}", workerName, queue, e);
                try {
                    Thread.sleep(errorBackoff.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    /**
     * Claims and processes at most one task.
     *
     * @return true if a task was claimed
     */
    boolean runOnce(String queue, String workerName) {
        Optional<TaskRecord> claimed = engine.dequeue(queue);
        if (claimed.isEmpty()) {
            return false;
        }
        process(claimed.get(), workerName);
        return true;
    }

    private void process(TaskRecord task, String workerName) {
        MDC.put("taskId", task.getId());
        MDC.put("queue", task.getQueue());
        MDC.put("taskType", task.getType());
        MDC.put("worker", workerName);
        inFlight.add(task.getId());
        activeWorkers.incrementAndGet();

        try {
            TaskOutcome outcome;
            try {
                outcome = registry.process(task);
            } catch (Exception e) {
                log.warn("Handler threw for task {}: {}", task.getId(), e.toString());
                outcome = TaskOutcome.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
            }

            if (outcome.isSuccess()) {
                engine.markCompleted(task.getId(), outcome.getResult());
            } else {
                engine.markFailed(task.getId(), outcome.getError(), true);
            }
        } finally {
            inFlight.remove(task.getId());
            activeWorkers.decrementAndGet();
            MDC.clear();
        }
    }

    // A failing heartbeat must not cancel the schedule.
    void extendLeases() {
        for (String taskId : inFlight) {
            try {
                if (!engine.extendLease(taskId)) {
                    log.debug("Lease for task {} no longer held", taskId);
                }
            } catch (RuntimeException e) {
                log.warn("Heartbeat failed for task {}: {}", taskId, e.getMessage());
            }
        }
    }

    int inFlightCount() {
        return inFlight.size();
    }
}
