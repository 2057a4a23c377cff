package com.taskq.engine.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DefaultCrudHandlerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private DataSink dataSink;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DefaultCrudHandler handler;

    @BeforeEach
    void setUp() {
        handler = new DefaultCrudHandler(dataSink, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private JsonNode json(String value) throws Exception {
        return objectMapper.readTree(value);
    }

    @Test
    void insert_addsTimestampAndReturnsInsertedId() throws Exception {
        when(dataSink.insert(eq("users"), any(ObjectNode.class))).thenReturn("doc-1");

        TaskOutcome outcome = handler.handle(json(
                "{\"operation\":\"insert\",\"collection\":\"users\",\"data\":{\"name\":\"ada\"}}"));

        assertTrue(outcome.isSuccess());
        assertEquals("doc-1", outcome.getResult().get("inserted_id").asText());

        ArgumentCaptor<ObjectNode> stored = ArgumentCaptor.forClass(ObjectNode.class);
        verify(dataSink).insert(eq("users"), stored.capture());
        assertEquals("ada", stored.getValue().get("name").asText());
        assertEquals(NOW.toString(), stored.getValue().get("timestamp").asText());
    }

    @Test
    void insert_failsWhenNothingStored() throws Exception {
        when(dataSink.insert(eq("users"), any(ObjectNode.class))).thenReturn(null);

        assertFalse(handler.handle(json("{\"operation\":\"insert\",\"collection\":\"users\",\"data\":{}}")).isSuccess());
    }

    @Test
    void update_succeedsWhenDocumentsMatched() throws Exception {
        when(dataSink.update(eq("users"), any(ObjectNode.class), any(ObjectNode.class))).thenReturn(2);

        TaskOutcome outcome = handler.handle(json("{\"operation\":\"update\",\"collection\":\"users\","
                + "\"query\":{\"name\":\"ada\"},\"update_data\":{\"active\":true}}"));

        assertTrue(outcome.isSuccess());
        assertEquals(2, outcome.getResult().get("matched").asInt());
    }

    @Test
    void update_failsWhenNothingMatched() throws Exception {
        when(dataSink.update(eq("users"), any(ObjectNode.class), any(ObjectNode.class))).thenReturn(0);

        assertFalse(handler.handle(json("{\"operation\":\"update\",\"collection\":\"users\","
                + "\"query\":{\"name\":\"x\"},\"update_data\":{\"active\":true}}")).isSuccess());
    }

    @Test
    void update_requiresQueryAndChanges() throws Exception {
        assertFalse(handler.handle(json("{\"operation\":\"update\",\"collection\":\"users\","
                + "\"update_data\":{\"active\":true}}")).isSuccess());
        assertFalse(handler.handle(json("{\"operation\":\"update\",\"collection\":\"users\","
                + "\"query\":{\"name\":\"ada\"},\"update_data\":{}}")).isSuccess());
        verifyNoInteractions(dataSink);
    }

    @Test
    void delete_requiresNonEmptyQuery() throws Exception {
        assertFalse(handler.handle(json("{\"operation\":\"delete\",\"collection\":\"users\",\"query\":{}}")).isSuccess());
        verifyNoInteractions(dataSink);
    }

    @Test
    void delete_succeedsWhenDocumentsRemoved() throws Exception {
        when(dataSink.delete(eq("users"), any(ObjectNode.class))).thenReturn(1);

        TaskOutcome outcome = handler.handle(json(
                "{\"operation\":\"DELETE\",\"collection\":\"users\",\"query\":{\"name\":\"ada\"}}"));

        assertTrue(outcome.isSuccess());
        assertEquals(1, outcome.getResult().get("deleted").asInt());
    }

    @Test
    void find_succeedsEvenWithNoMatches() throws Exception {
        when(dataSink.find(eq("users"), any(ObjectNode.class))).thenReturn(List.of());

        TaskOutcome outcome = handler.handle(json("{\"operation\":\"find\",\"collection\":\"users\"}"));

        assertTrue(outcome.isSuccess());
        assertTrue(outcome.getResult().isArray());
        assertEquals(0, outcome.getResult().size());
    }

    @Test
    void find_returnsMatchedDocuments() throws Exception {
        when(dataSink.find(eq("users"), any(ObjectNode.class))).thenReturn(List.of(json("{\"name\":\"ada\"}")));

        TaskOutcome outcome = handler.handle(json(
                "{\"operation\":\"find\",\"collection\":\"users\",\"query\":{\"name\":\"ada\"}}"));

        assertEquals("ada", outcome.getResult().get(0).get("name").asText());
    }

    @Test
    void rejectsMalformedPayloads() throws Exception {
        assertFalse(handler.handle(json("[1,2]")).isSuccess());
        assertFalse(handler.handle(null).isSuccess());
        assertFalse(handler.handle(json("{\"collection\":\"users\"}")).isSuccess());
        assertFalse(handler.handle(json("{\"operation\":\"insert\"}")).isSuccess());
        assertFalse(handler.handle(json("{\"operation\":\"upsert\",\"collection\":\"users\"}")).isSuccess());
        assertFalse(handler.handle(json("{\"operation\":\"insert\",\"collection\":\"users\",\"data\":[1]}")).isSuccess());
        verify(dataSink, never()).insert(anyString(), any());
    }

    @Test
    void sinkFailurePropagates() throws Exception {
        when(dataSink.delete(eq("users"), any(ObjectNode.class))).thenThrow(new IllegalStateException("db down"));

        assertThrows(IllegalStateException.class, () -> handler.handle(json(
                "{\"operation\":\"delete\",\"collection\":\"users\",\"query\":{\"id\":1}}")));
    }
}
