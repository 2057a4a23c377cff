package com.taskq.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.taskq.common.constants.QueueConstants;

import java.time.Instant;

/**
 * Envelope for one unit of deferred work and its lifecycle state.
 * Persisted as JSON under {@code queue:task:{id}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskRecord {

    @JsonProperty("id")
    private String id;

    @JsonProperty("queue")
    private String queue;

    @JsonProperty("type")
    private String type;

    @JsonProperty("payload")
    private JsonNode payload;

    @JsonProperty("priority")
    private TaskPriority priority;

    @JsonProperty("status")
    private TaskStatus status;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("processing_started_at")
    private Instant processingStartedAt;

    @JsonProperty("completed_at")
    private Instant completedAt;

    @JsonProperty("last_failed_at")
    private Instant lastFailedAt;

    @JsonProperty("attempts")
    private int attempts;

    @JsonProperty("max_attempts")
    private int maxAttempts = QueueConstants.DEFAULT_MAX_ATTEMPTS;

    @JsonProperty("process_after")
    private Instant processAfter;

    @JsonProperty("result")
    private JsonNode result;

    @JsonProperty("last_error")
    private String lastError;

    public TaskRecord() {}

    public TaskRecord(String id, String queue, String type, JsonNode payload,
                      TaskPriority priority, Instant createdAt, Instant processAfter) {
        this.id = id;
        this.queue = queue;
        this.type = type;
        this.payload = payload;
        this.priority = priority;
        this.status = TaskStatus.PENDING;
        this.createdAt = createdAt;
        this.processAfter = processAfter;
        this.attempts = 0;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getQueue() { return queue; }
    public void setQueue(String queue) { this.queue = queue; }
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public JsonNode getPayload() { return payload; }
    public void setPayload(JsonNode payload) { this.payload = payload; }
    public TaskPriority getPriority() { return priority; }
    public void setPriority(TaskPriority priority) { this.priority = priority; }
    public TaskStatus getStatus() { return status; }
    public void setStatus(TaskStatus status) { this.status = status; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getProcessingStartedAt() { return processingStartedAt; }
    public void setProcessingStartedAt(Instant processingStartedAt) { this.processingStartedAt = processingStartedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
    public Instant getLastFailedAt() { return lastFailedAt; }
    public void setLastFailedAt(Instant lastFailedAt) { this.lastFailedAt = lastFailedAt; }
    public int getAttempts() { return attempts; }
    public void setAttempts(int attempts) { this.attempts = attempts; }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public Instant getProcessAfter() { return processAfter; }
    public void setProcessAfter(Instant processAfter) { this.processAfter = processAfter; }
    public JsonNode getResult() { return result; }
    public void setResult(JsonNode result) { this.result = result; }
    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }
}
