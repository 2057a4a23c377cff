package com.taskq.engine.handler;

import com.fasterxml.jackson.databind.JsonNode;

public final class TaskOutcome {

    private final boolean success;
    private final JsonNode result;
    private final String error;

    private TaskOutcome(boolean success, JsonNode result, String error) {
        this.success = success;
        this.result = result;
        this.error = error;
    }

    public static TaskOutcome success() {
        return new TaskOutcome(true, null, null);
    }

    public static TaskOutcome success(JsonNode result) {
        return new TaskOutcome(true, result, null);
    }

    public static TaskOutcome failure(String error) {
        return new TaskOutcome(false, null, error);
    }

    public boolean isSuccess() { return success; }
    public JsonNode getResult() { return result; }
    public String getError() { return error; }
}
