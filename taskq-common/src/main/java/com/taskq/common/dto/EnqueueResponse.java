package com.taskq.common.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class EnqueueResponse {

    @JsonProperty("task_id")
    private String taskId;

    @JsonProperty("queue_name")
    private String queueName;

    @JsonProperty("status")
    private String status;

    public EnqueueResponse() {}

    public EnqueueResponse(String taskId, String queueName, String status) {
        this.taskId = taskId;
        this.queueName = queueName;
        this.status = status;
    }

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }
    public String getQueueName() { return queueName; }
    public void setQueueName(String queueName) { this.queueName = queueName; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
}
