package com.taskq.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.taskq.common.constants.QueueConstants;
import com.taskq.common.dto.QueueStats;
import com.taskq.common.model.TaskPriority;
import com.taskq.common.model.TaskRecord;
import com.taskq.common.model.TaskStatus;
import com.taskq.engine.StoreUnavailableException;
import com.taskq.engine.TaskCodecException;
import com.taskq.engine.TaskNotFoundException;
import com.taskq.engine.UnknownQueueException;
import com.taskq.engine.config.TaskQueueProperties;
import com.taskq.engine.store.RecordWrite;
import com.taskq.engine.store.TaskStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Enqueue, claim, finalize and reschedule tasks held in the shared store.
 * Holds no task state of its own; every operation is a read-modify-write against {@link TaskStore}.
 */
@Service
public class QueueEngine {

    private static final Logger log = LoggerFactory.getLogger(QueueEngine.class);

    private static final int STATS_BATCH = 200;

    private final TaskStore store;
    private final TaskRecordCodec codec;
    private final TaskQueueProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public QueueEngine(TaskStore store, TaskRecordCodec codec, TaskQueueProperties properties,
                       Clock clock, MeterRegistry meterRegistry) {
        this.store = store;
        this.codec = codec;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        if (properties.getQueues().isEmpty()) {
            log.warn("No queues configured under taskq.queues; every enqueue will be rejected");
        }
    }

    public Set<String> queueNames() {
        return Collections.unmodifiableSet(properties.getQueues().keySet());
    }

    public boolean hasQueue(String queueName) {
        return queueName != null && properties.getQueues().containsKey(queueName);
    }

    public String enqueue(String queueName, String taskType, JsonNode payload) {
        return enqueue(queueName, taskType, payload, TaskPriority.NORMAL, Duration.ZERO);
    }

    public String enqueue(String queueName, String taskType, JsonNode payload, TaskPriority priority) {
        return enqueue(queueName, taskType, payload, priority, Duration.ZERO);
    }

    /**
     * Persists a new PENDING task and schedules it on the {@code (queue, priority)} ready-set,
     * eligible once {@code delay} has elapsed. Record and ready-set entry are written atomically.
     *
     * @return the generated task id
     * @throws UnknownQueueException if the queue is not configured
     * @throws StoreUnavailableException if the store could not be written
     */
    public String enqueue(String queueName, String taskType, JsonNode payload,
                          TaskPriority priority, Duration delay) {
        TaskQueueProperties.QueueDefinition queue = requireQueue(queueName);
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType is required");
        }
        if (priority == null) {
            priority = TaskPriority.NORMAL;
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        if (delay.getSeconds() > QueueConstants.MAX_DELAY_SECONDS) {
            throw new IllegalArgumentException("delay must not exceed " + QueueConstants.MAX_DELAY_SECONDS + " seconds");
        }

        String taskId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        Instant processAfter = now.plus(delay);

        TaskRecord record = new TaskRecord(taskId, queueName, taskType,
                payload != null ? payload : JsonNodeFactory.instance.objectNode(),
                priority, now, processAfter);
        record.setMaxAttempts(queue.getMaxAttempts());

        store.apply(RecordWrite.of(QueueConstants.taskKey(taskId), taskId, codec.encode(record),
                        activeTtl(now, processAfter))
                .schedule(QueueConstants.readyKey(queueName, priority), QueueConstants.score(processAfter)));

        try {
            store.increment(QueueConstants.enqueuedCounterKey(queueName));
        } catch (StoreUnavailableException e) {
            log.warn("Enqueue counter not updated for queue {}: {}", queueName, e.getMessage());
        }

        Counter.builder("taskq_tasks_enqueued_total")
                .tag("queue", queueName)
                .tag("priority", priority.name())
                .register(meterRegistry).increment();

        log.info("Task enqueued: taskId={}, queue={}, type={}, priority={}, delay={}s",
                taskId, queueName, taskType, priority, delay.toSeconds());
        return taskId;
    }

    public Optional<TaskRecord> dequeue(String queueName) {
        return dequeue(queueName, null);
    }

    /**
     * Claims the earliest ready task, scanning tiers from CRITICAL to LOW, or only {@code priority}
     * when given. A candidate belongs to this caller only if removing it from the ready-set
     * removed exactly one member; otherwise another worker took it and the next candidate is tried.
     */
    public Optional<TaskRecord> dequeue(String queueName, TaskPriority priority) {
        requireQueue(queueName);
        TaskPriority[] tiers = priority != null ? new TaskPriority[]{priority} : TaskPriority.scanOrder();

        for (TaskPriority tier : tiers) {
            String readyKey = QueueConstants.readyKey(queueName, tier);
            double now = QueueConstants.score(clock.instant());
            // Every candidate leaves the ready-set, so re-reading the first page drains the tier.
            List<String> candidates = store.rangeByScore(readyKey, 0, now, 0, properties.getDequeueBatch());
            while (!candidates.isEmpty()) {
                for (String taskId : candidates) {
                    if (store.removeScored(readyKey, taskId) == 0) {
                        log.debug("Task {} already claimed from {}", taskId, readyKey);
                        continue;
                    }
                    Optional<TaskRecord> claimed = markProcessing(taskId, readyKey);
                    if (claimed.isPresent()) {
                        return claimed;
                    }
                }
                candidates = store.rangeByScore(readyKey, 0, now, 0, properties.getDequeueBatch());
            }
        }
        return Optional.empty();
    }

    private Optional<TaskRecord> markProcessing(String taskId, String readyKey) {
        TaskRecord record;
        try {
            Optional<TaskRecord> loaded = load(taskId);
            if (loaded.isEmpty()) {
                log.warn("Dropped ready entry without record: taskId={}, readySet={}", taskId, readyKey);
                return Optional.empty();
            }
            record = loaded.get();
        } catch (TaskCodecException e) {
            log.error("Dropped undecodable task record: taskId={}", taskId, e);
            return Optional.empty();
        }

        if (record.getStatus() == null || !record.getStatus().isClaimable()) {
            log.warn("Dropped ready entry for task in status {}: taskId={}", record.getStatus(), taskId);
            return Optional.empty();
        }

        Instant now = clock.instant();
        Instant leaseDeadline = now.plus(properties.getLease().getDuration());
        record.setStatus(TaskStatus.PROCESSING);
        record.setProcessingStartedAt(now);

        store.apply(RecordWrite.of(QueueConstants.taskKey(taskId), taskId, codec.encode(record),
                        activeTtl(now, leaseDeadline))
                .schedule(QueueConstants.leaseKey(record.getQueue()), QueueConstants.score(leaseDeadline)));

        log.info("Task claimed: taskId={}, queue={}, type={}, attempt={}",
                taskId, record.getQueue(), record.getType(), record.getAttempts() + 1);
        return Optional.of(record);
    }

    public boolean markCompleted(String taskId) {
        return markCompleted(taskId, null);
    }

    /**
     * @return false if the record no longer exists or is already terminal
     */
    public boolean markCompleted(String taskId, JsonNode result) {
        Optional<TaskRecord> loaded = load(taskId);
        if (loaded.isEmpty()) {
            log.warn("Cannot complete task {}: record not found", taskId);
            return false;
        }
        TaskRecord record = loaded.get();
        if (record.getStatus() != null && record.getStatus().isTerminal()) {
            log.warn("Cannot complete task {}: already {}", taskId, record.getStatus().getValue());
            return false;
        }

        Instant now = clock.instant();
        record.setStatus(TaskStatus.COMPLETED);
        record.setCompletedAt(now);
        record.setResult(result);

        store.apply(terminalWrite(record, properties.getTtl().getCompleted()));

        Counter.builder("taskq_tasks_finished_total")
                .tag("queue", record.getQueue())
                .tag("type", record.getType())
                .tag("status", TaskStatus.COMPLETED.name())
                .register(meterRegistry).increment();

        if (record.getProcessingStartedAt() != null) {
            Duration elapsed = Duration.between(record.getProcessingStartedAt(), now);
            Timer.builder("taskq.task.processing.seconds")
                    .tag("queue", record.getQueue())
                    .tag("type", record.getType())
                    .register(meterRegistry)
                    .record(elapsed);
            log.info("Task completed: taskId={}, type={}, duration={}ms", taskId, record.getType(), elapsed.toMillis());
        } else {
            log.info("Task completed: taskId={}, type={}", taskId, record.getType());
        }
        return true;
    }

    /**
     * Records a failed attempt. While {@code retry} is set and attempts remain, the task is
     * rescheduled after {@code min(base * 2^attempts, max)}; otherwise it becomes FAILED.
     *
     * @return false if the record no longer exists or is already terminal
     */
    public boolean markFailed(String taskId, String error, boolean retry) {
        Optional<TaskRecord> loaded = load(taskId);
        if (loaded.isEmpty()) {
            log.warn("Cannot fail task {}: record not found", taskId);
            return false;
        }
        TaskRecord record = loaded.get();
        if (record.getStatus() != null && record.getStatus().isTerminal()) {
            log.warn("Cannot fail task {}: already {}", taskId, record.getStatus().getValue());
            return false;
        }

        Instant now = clock.instant();
        record.setAttempts(record.getAttempts() + 1);
        record.setLastError(error);
        record.setLastFailedAt(now);

        RecordWrite write;
        if (retry && record.getAttempts() < record.getMaxAttempts()) {
            long backoff = QueueConstants.backoffSeconds(record.getAttempts(),
                    properties.getBackoff().getBase().toSeconds(),
                    properties.getBackoff().getMax().toSeconds());
            Instant processAfter = now.plusSeconds(backoff);
            record.setStatus(TaskStatus.RETRY);
            record.setProcessAfter(processAfter);

            write = RecordWrite.of(QueueConstants.taskKey(taskId), taskId, codec.encode(record),
                            activeTtl(now, processAfter))
                    .unschedule(QueueConstants.leaseKey(record.getQueue()))
                    .schedule(QueueConstants.readyKey(record.getQueue(), record.getPriority()),
                            QueueConstants.score(processAfter));

            Counter.builder("taskq_retry_total")
                    .tag("queue", record.getQueue())
                    .tag("attempt", String.valueOf(record.getAttempts()))
                    .register(meterRegistry).increment();

            log.info("Task scheduled for retry: taskId={}, attempt={}/{}, backoff={}s, error={}",
                    taskId, record.getAttempts(), record.getMaxAttempts(), backoff, error);
        } else {
            record.setStatus(TaskStatus.FAILED);
            write = terminalWrite(record, properties.getTtl().getFailed());

            Counter.builder("taskq_tasks_finished_total")
                    .tag("queue", record.getQueue())
                    .tag("type", record.getType())
                    .tag("status", TaskStatus.FAILED.name())
                    .register(meterRegistry).increment();

            log.error("Task failed: taskId={}, type={}, attempts={}, error={}",
                    taskId, record.getType(), record.getAttempts(), error);
        }

        store.apply(write);
        return true;
    }

    public Optional<TaskRecord> getTaskStatus(String taskId) {
        return load(taskId);
    }

    /**
     * Pushes the lease deadline of a PROCESSING task forward and keeps its record alive past
     * the new deadline. Has no effect once the task left the lease set (finished, or reclaimed
     * by the reaper).
     *
     * @return true if the lease was extended
     * @throws TaskNotFoundException if the record no longer exists
     */
    public boolean extendLease(String taskId) {
        String json = store.get(QueueConstants.taskKey(taskId))
                .orElseThrow(() -> new TaskNotFoundException(taskId));
        TaskRecord record = codec.decode(json);
        Instant now = clock.instant();
        Instant deadline = now.plus(properties.getLease().getDuration());
        return store.rescoreIfPresent(QueueConstants.leaseKey(record.getQueue()), taskId,
                QueueConstants.score(deadline), QueueConstants.taskKey(taskId), activeTtl(now, deadline));
    }

    /**
     * Fails every task of {@code queueName} whose lease deadline has passed, consuming an attempt,
     * so work claimed by a crashed or hung worker is retried or ends FAILED.
     *
     * @return number of tasks reclaimed
     */
    public int reclaimExpiredLeases(String queueName) {
        requireQueue(queueName);
        String leaseKey = QueueConstants.leaseKey(queueName);
        double now = QueueConstants.score(clock.instant());
        List<String> expired = store.rangeByScore(leaseKey, 0, now, 0, properties.getLease().getReclaimBatch());

        int reclaimed = 0;
        for (String taskId : expired) {
            if (store.removeScored(leaseKey, taskId) == 0) {
                continue;
            }
            Optional<TaskRecord> record = load(taskId);
            if (record.isEmpty() || record.get().getStatus() != TaskStatus.PROCESSING) {
                continue;
            }
            log.warn("Lease expired: taskId={}, queue={}, type={}, startedAt={}",
                    taskId, queueName, record.get().getType(), record.get().getProcessingStartedAt());
            if (markFailed(taskId, "Lease expired after " + properties.getLease().getDuration(), true)) {
                reclaimed++;
            }
        }

        if (reclaimed > 0) {
            Counter.builder("taskq_leases_reclaimed_total")
                    .tag("queue", queueName)
                    .register(meterRegistry).increment(reclaimed);
        }
        return reclaimed;
    }

    public Map<String, QueueStats> getQueueStats() {
        return getQueueStats(null);
    }

    /**
     * Counts stored records by status for one queue, or for every configured queue when
     * {@code queueName} is null. Scans all task keys, so it is meant for dashboards only.
     * An unknown queue name yields an empty map.
     */
    public Map<String, QueueStats> getQueueStats(String queueName) {
        Collection<String> names;
        if (queueName == null) {
            names = properties.getQueues().keySet();
        } else if (hasQueue(queueName)) {
            names = List.of(queueName);
        } else {
            return Collections.emptyMap();
        }

        Map<String, QueueStats> stats = new LinkedHashMap<>();
        for (String name : names) {
            QueueStats queueStats = new QueueStats();
            long ready = 0;
            for (TaskPriority priority : TaskPriority.values()) {
                ready += store.countScored(QueueConstants.readyKey(name, priority));
            }
            queueStats.setReady(ready);
            queueStats.setEnqueued(store.get(QueueConstants.enqueuedCounterKey(name))
                    .map(Long::parseLong).orElse(0L));
            stats.put(name, queueStats);
        }

        List<String> keys = store.scanKeys(QueueConstants.TASK_KEY_PATTERN);
        for (int from = 0; from < keys.size(); from += STATS_BATCH) {
            List<String> batch = keys.subList(from, Math.min(from + STATS_BATCH, keys.size()));
            for (String json : store.multiGet(batch)) {
                if (json == null) {
                    continue;
                }
                TaskRecord record;
                try {
                    record = codec.decode(json);
                } catch (TaskCodecException e) {
                    log.warn("Skipping undecodable record in stats scan: {}", e.getMessage());
                    continue;
                }
                QueueStats queueStats = stats.get(record.getQueue());
                if (queueStats != null && record.getStatus() != null) {
                    queueStats.increment(record.getStatus());
                }
            }
        }
        return stats;
    }

    private TaskQueueProperties.QueueDefinition requireQueue(String queueName) {
        TaskQueueProperties.QueueDefinition queue = queueName != null ? properties.queue(queueName) : null;
        if (queue == null) {
            throw new UnknownQueueException(queueName);
        }
        return queue;
    }

    private Optional<TaskRecord> load(String taskId) {
        return store.get(QueueConstants.taskKey(taskId)).map(codec::decode);
    }

    private RecordWrite terminalWrite(TaskRecord record, Duration ttl) {
        return RecordWrite.of(QueueConstants.taskKey(record.getId()), record.getId(), codec.encode(record), ttl)
                .unschedule(QueueConstants.leaseKey(record.getQueue()))
                .unschedule(QueueConstants.readyKey(record.getQueue(), record.getPriority()));
    }

    // Active records must outlive the moment they become eligible (or their lease runs out).
    private Duration activeTtl(Instant now, Instant until) {
        Duration window = Duration.between(now, until);
        return properties.getTtl().getActive().plus(window.isNegative() ? Duration.ZERO : window);
    }
}
