package com.taskq.common.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.taskq.common.model.TaskPriority;

public class EnqueueRequest {

    @JsonProperty("queue_name")
    private String queueName;

    @JsonProperty("task_type")
    private String taskType;

    @JsonProperty("task_data")
    private JsonNode taskData;

    @JsonProperty("priority")
    private TaskPriority priority = TaskPriority.NORMAL;

    /** Seconds before the task becomes eligible for dequeue. */
    @JsonProperty("delay")
    private long delay;

    public EnqueueRequest() {}

    public String getQueueName() { return queueName; }
    public void setQueueName(String queueName) { this.queueName = queueName; }
    public String getTaskType() { return taskType; }
    public void setTaskType(String taskType) { this.taskType = taskType; }
    public JsonNode getTaskData() { return taskData; }
    public void setTaskData(JsonNode taskData) { this.taskData = taskData; }
    public TaskPriority getPriority() { return priority; }
    public void setPriority(TaskPriority priority) { this.priority = priority; }
    public long getDelay() { return delay; }
    public void setDelay(long delay) { this.delay = delay; }
}
