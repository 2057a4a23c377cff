package com.taskq.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskq.common.model.TaskRecord;
import com.taskq.engine.TaskCodecException;
import org.springframework.stereotype.Component;

/**
 * Single (de)serialization point for task records stored under {@code queue:task:{id}}.
 */
@Component
public class TaskRecordCodec {

    private final ObjectMapper objectMapper;

    public TaskRecordCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(TaskRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new TaskCodecException("Failed to encode task " + record.getId(), e);
        }
    }

    public TaskRecord decode(String json) {
        try {
            return objectMapper.readValue(json, TaskRecord.class);
        } catch (JsonProcessingException e) {
            throw new TaskCodecException("Failed to decode task record", e);
        }
    }
}
