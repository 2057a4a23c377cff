package com.taskq.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskq.common.model.TaskStatus;

/**
 * Per-queue counts. Status counts come from the stored records; {@code ready} is the
 * combined size of the queue's ready-sets and {@code enqueued} the lifetime enqueue counter.
 */
public class QueueStats {

    @JsonProperty("pending")
    private long pending;

    @JsonProperty("processing")
    private long processing;

    @JsonProperty("retry")
    private long retry;

    @JsonProperty("completed")
    private long completed;

    @JsonProperty("failed")
    private long failed;

    @JsonProperty("ready")
    private long ready;

    @JsonProperty("enqueued")
    private long enqueued;

    public QueueStats() {}

    public void increment(TaskStatus status) {
        switch (status) {
            case PENDING -> pending++;
            case PROCESSING -> processing++;
            case RETRY -> retry++;
            case COMPLETED -> completed++;
            case FAILED -> failed++;
        }
    }

    public long count(TaskStatus status) {
        return switch (status) {
            case PENDING -> pending;
            case PROCESSING -> processing;
            case RETRY -> retry;
            case COMPLETED -> completed;
            case FAILED -> failed;
        };
    }

    /** Number of task records still held by the store, across all statuses. */
    @JsonIgnore
    public long totalRecords() {
        return pending + processing + retry + completed + failed;
    }

    public long getPending() { return pending; }
    public void setPending(long pending) { this.pending = pending; }
    public long getProcessing() { return processing; }
    public void setProcessing(long processing) { this.processing = processing; }
    public long getRetry() { return retry; }
    public void setRetry(long retry) { this.retry = retry; }
    public long getCompleted() { return completed; }
    public void setCompleted(long completed) { this.completed = completed; }
    public long getFailed() { return failed; }
    public void setFailed(long failed) { this.failed = failed; }
    public long getReady() { return ready; }
    public void setReady(long ready) { this.ready = ready; }
    public long getEnqueued() { return enqueued; }
    public void setEnqueued(long enqueued) { this.enqueued = enqueued; }
}
