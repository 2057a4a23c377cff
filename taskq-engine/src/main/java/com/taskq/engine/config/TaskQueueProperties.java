package com.taskq.engine.config;

import com.taskq.common.constants.QueueConstants;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "taskq")
public class TaskQueueProperties {

    /** Declared queues, keyed by name. Enqueue to any other name fails. */
    private Map<String, QueueDefinition> queues = new LinkedHashMap<>();

    /** Ready candidates fetched per tier on each dequeue attempt. */
    private int dequeueBatch = 10;

    private final Backoff backoff = new Backoff();
    private final Ttl ttl = new Ttl();
    private final Lease lease = new Lease();
    private final Worker worker = new Worker();

    public QueueDefinition queue(String name) {
        return queues.get(name);
    }

    public Map<String, QueueDefinition> getQueues() { return queues; }
    public void setQueues(Map<String, QueueDefinition> queues) { this.queues = queues; }
    public int getDequeueBatch() { return dequeueBatch; }
    public void setDequeueBatch(int dequeueBatch) { this.dequeueBatch = dequeueBatch; }
    public Backoff getBackoff() { return backoff; }
    public Ttl getTtl() { return ttl; }
    public Lease getLease() { return lease; }
    public Worker getWorker() { return worker; }

    public static class QueueDefinition {
        private int workers = 1;
        private int maxAttempts = QueueConstants.DEFAULT_MAX_ATTEMPTS;

        public QueueDefinition() {}

        public QueueDefinition(int workers, int maxAttempts) {
            this.workers = workers;
            this.maxAttempts = maxAttempts;
        }

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }

    public static class Backoff {
        private Duration base = Duration.ofSeconds(QueueConstants.BACKOFF_BASE_SECONDS);
        private Duration max = Duration.ofSeconds(QueueConstants.BACKOFF_MAX_SECONDS);

        public Duration getBase() { return base; }
        public void setBase(Duration base) { this.base = base; }
        public Duration getMax() { return max; }
        public void setMax(Duration max) { this.max = max; }
    }

    public static class Ttl {
        /** Retention for PENDING, RETRY and PROCESSING records beyond their scheduled time. */
        private Duration active = Duration.ofHours(24);
        private Duration completed = Duration.ofHours(1);
        private Duration failed = Duration.ofHours(24);

        public Duration getActive() { return active; }
        public void setActive(Duration active) { this.active = active; }
        public Duration getCompleted() { return completed; }
        public void setCompleted(Duration completed) { this.completed = completed; }
        public Duration getFailed() { return failed; }
        public void setFailed(Duration failed) { this.failed = failed; }
    }

    public static class Lease {
        private Duration duration = Duration.ofMinutes(15);
        private int reclaimBatch = 100;

        public Duration getDuration() { return duration; }
        public void setDuration(Duration duration) { this.duration = duration; }
        public int getReclaimBatch() { return reclaimBatch; }
        public void setReclaimBatch(int reclaimBatch) { this.reclaimBatch = reclaimBatch; }
    }

    public static class Worker {
        private boolean enabled = false;
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration errorBackoff = Duration.ofSeconds(5);
        private Duration shutdownTimeout = Duration.ofSeconds(5);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public Duration getErrorBackoff() { return errorBackoff; }
        public void setErrorBackoff(Duration errorBackoff) { this.errorBackoff = errorBackoff; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
        public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }
    }
}
