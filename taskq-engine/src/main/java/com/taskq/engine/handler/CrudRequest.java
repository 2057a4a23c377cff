package com.taskq.engine.handler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Payload envelope understood by {@link DefaultCrudHandler}:
 * {@code {operation, collection, data | query | update_data}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrudRequest {

    @JsonProperty("operation")
    private String operation;

    @JsonProperty("collection")
    private String collection;

    @JsonProperty("data")
    private ObjectNode data;

    @JsonProperty("query")
    private ObjectNode query;

    @JsonProperty("update_data")
    private ObjectNode updateData;

    public CrudRequest() {}

    public String getOperation() { return operation; }
    public void setOperation(String operation) { this.operation = operation; }
    public String getCollection() { return collection; }
    public void setCollection(String collection) { this.collection = collection; }
    public ObjectNode getData() { return data; }
    public void setData(ObjectNode data) { this.data = data; }
    public ObjectNode getQuery() { return query; }
    public void setQuery(ObjectNode query) { this.query = query; }
    public ObjectNode getUpdateData() { return updateData; }
    public void setUpdateData(ObjectNode updateData) { this.updateData = updateData; }
}
