package com.taskq.engine.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Document store written by the default CRUD handler. Queries match documents that
 * contain every field of the query object. Implementations throw on adapter faults.
 */
public interface DataSink {

    /** @return id of the stored document, or null if nothing was stored */
    String insert(String collection, ObjectNode document);

    /** Merges {@code changes} into every matching document; returns the number matched. */
    int update(String collection, ObjectNode query, ObjectNode changes);

    int delete(String collection, ObjectNode query);

    List<JsonNode> find(String collection, ObjectNode query);
}
