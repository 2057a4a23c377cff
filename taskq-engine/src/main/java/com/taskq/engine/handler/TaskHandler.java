package com.taskq.engine.handler;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Processes the payload of one task. Returning false or throwing marks the attempt as failed.
 */
@FunctionalInterface
public interface TaskHandler {

    boolean handle(JsonNode payload) throws Exception;
}
