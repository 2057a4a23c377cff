package com.taskq.worker.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskq.engine.handler.DataSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * {@link DataSink} over a single PostgreSQL {@code documents} table, one jsonb body per row.
 * Returned documents carry their row id as {@code _id}.
 */
@Component
@Transactional
public class JpaDataSink implements DataSink {

    private static final Logger log = LoggerFactory.getLogger(JpaDataSink.class);

    private final StoredDocumentRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JpaDataSink(StoredDocumentRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String insert(String collection, ObjectNode document) {
        UUID id = UUID.randomUUID();
        repository.save(new StoredDocument(id, collection, write(document), clock.instant()));
        log.debug("Inserted document {} into {}", id, collection);
        return id.toString();
    }

    @Override
    public int update(String collection, ObjectNode query, ObjectNode changes) {
        int matched = repository.mergeMatching(collection, write(query), write(changes), clock.instant());
        log.debug("Updated {} document(s) in {}", matched, collection);
        return matched;
    }

    @Override
    public int delete(String collection, ObjectNode query) {
        int deleted = repository.deleteMatching(collection, write(query));
        log.debug("Deleted {} document(s) from {}", deleted, collection);
        return deleted;
    }

    @Override
    @Transactional(readOnly = true)
    public List<JsonNode> find(String collection, ObjectNode query) {
        List<JsonNode> documents = new ArrayList<>();
        for (StoredDocument stored : repository.findMatching(collection, write(query))) {
            ObjectNode node = read(stored);
            node.put("_id", stored.getId().toString());
            documents.add(node);
        }
        return documents;
    }

    private String write(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document is not serializable", e);
        }
    }

    private ObjectNode read(StoredDocument stored) {
        try {
            JsonNode node = objectMapper.readTree(stored.getBody());
            if (node.isObject()) {
                return (ObjectNode) node;
            }
            ObjectNode wrapped = objectMapper.createObjectNode();
            wrapped.set("value", node);
            return wrapped;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored document " + stored.getId() + " is not valid JSON", e);
        }
    }
}
