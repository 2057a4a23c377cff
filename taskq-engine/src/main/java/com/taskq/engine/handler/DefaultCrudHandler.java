package com.taskq.engine.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Fallback for task types without a registered handler: treats the payload as a
 * {@link CrudRequest} against the configured {@link DataSink}. Bad payloads yield a failed
 * outcome; sink exceptions propagate.
 */
@Component
public class DefaultCrudHandler {

    private static final Logger log = LoggerFactory.getLogger(DefaultCrudHandler.class);

    private final DataSink dataSink;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DefaultCrudHandler(DataSink dataSink, ObjectMapper objectMapper, Clock clock) {
        this.dataSink = dataSink;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public TaskOutcome handle(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return reject("Payload is not a JSON object");
        }

        CrudRequest request;
        try {
            request = objectMapper.treeToValue(payload, CrudRequest.class);
        } catch (JsonProcessingException e) {
            return reject("Malformed CRUD payload: " + e.getOriginalMessage());
        }

        if (isBlank(request.getOperation()) || isBlank(request.getCollection())) {
            return reject("Missing operation or collection in task data");
        }

        String collection = request.getCollection();
        return switch (request.getOperation().toLowerCase(Locale.ROOT)) {
            case "insert" -> insert(collection, request);
            case "update" -> update(collection, request);
            case "delete" -> delete(collection, request);
            case "find" -> find(collection, request);
            default -> reject("Unknown operation: " + request.getOperation());
        };
    }

    private TaskOutcome insert(String collection, CrudRequest request) {
        ObjectNode document = request.getData() != null ? request.getData().deepCopy() : objectMapper.createObjectNode();
        if (!document.has("timestamp")) {
            document.put("timestamp", clock.instant().toString());
        }
        String id = dataSink.insert(collection, document);
        if (id == null) {
            return reject("Insert into " + collection + " stored nothing");
        }
        ObjectNode result = objectMapper.createObjectNode();
        result.put("inserted_id", id);
        return TaskOutcome.success(result);
    }

    private TaskOutcome update(String collection, CrudRequest request) {
        if (isEmpty(request.getQuery()) || isEmpty(request.getUpdateData())) {
            return reject("Update requires query and update_data");
        }
        int matched = dataSink.update(collection, request.getQuery(), request.getUpdateData());
        if (matched == 0) {
            return reject("Update matched no documents in " + collection);
        }
        ObjectNode result = objectMapper.createObjectNode();
        result.put("matched", matched);
        return TaskOutcome.success(result);
    }

    private TaskOutcome delete(String collection, CrudRequest request) {
        if (isEmpty(request.getQuery())) {
            return reject("Delete requires a query");
        }
        int deleted = dataSink.delete(collection, request.getQuery());
        if (deleted == 0) {
            return reject("Delete matched no documents in " + collection);
        }
        ObjectNode result = objectMapper.createObjectNode();
        result.put("deleted", deleted);
        return TaskOutcome.success(result);
    }

    private TaskOutcome find(String collection, CrudRequest request) {
        ObjectNode query = request.getQuery() != null ? request.getQuery() : objectMapper.createObjectNode();
        List<JsonNode> documents = dataSink.find(collection, query);
        ArrayNode result = objectMapper.createArrayNode();
        result.addAll(documents);
        return TaskOutcome.success(result);
    }

    private TaskOutcome reject(String reason) {
        log.warn("Default handler rejected task: {}", reason);
        return TaskOutcome.failure(reason);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static boolean isEmpty(ObjectNode node) {
        return node == null || node.isEmpty();
    }
}
