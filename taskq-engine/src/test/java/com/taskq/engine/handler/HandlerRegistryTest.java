package com.taskq.engine.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskq.common.model.TaskPriority;
import com.taskq.common.model.TaskRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Instant;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HandlerRegistryTest {

    @Mock
    private DefaultCrudHandler defaultHandler;

    @Mock
    private ObjectProvider<NamedTaskHandler> namedHandlers;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private HandlerRegistry registry;

    @BeforeEach
    void setUp() {
        when(namedHandlers.orderedStream()).thenReturn(Stream.empty());
        registry = new HandlerRegistry(defaultHandler, namedHandlers);
    }

    private TaskRecord task(String type) {
        ObjectNode payload = objectMapper.createObjectNode().put("to", "ops@example.com");
        return new TaskRecord("t-1", "default", type, payload, TaskPriority.NORMAL, Instant.EPOCH, Instant.EPOCH);
    }

    @Test
    void process_usesRegisteredHandler() throws Exception {
        registry.register("email", payload -> payload.has("to"));

        TaskOutcome outcome = registry.process(task("email"));

        assertTrue(outcome.isSuccess());
        verifyNoInteractions(defaultHandler);
    }

    @Test
    void process_falseReturnBecomesFailure() throws Exception {
        registry.register("email", payload -> false);

        TaskOutcome outcome = registry.process(task("email"));

        assertFalse(outcome.isSuccess());
        assertTrue(outcome.getError().contains("email"));
    }

    @Test
    void process_propagatesHandlerException() {
        registry.register("email", payload -> {
            throw new IllegalStateException("smtp down");
        });

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> registry.process(task("email")));
        assertEquals("smtp down", e.getMessage());
    }

    @Test
    void process_fallsBackToDefaultHandler() throws Exception {
        TaskRecord task = task("db_operation");
        when(defaultHandler.handle(task.getPayload())).thenReturn(TaskOutcome.success());

        assertTrue(registry.process(task).isSuccess());
        assertFalse(registry.hasHandler("db_operation"));
    }

    @Test
    void register_replacesExistingHandler() throws Exception {
        registry.register("email", payload -> false);
        registry.register("email", payload -> true);

        assertTrue(registry.process(task("email")).isSuccess());
    }

    @Test
    void register_rejectsBlankType() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", payload -> true));
    }

    @Test
    void constructor_registersNamedHandlerBeans() throws Exception {
        NamedTaskHandler report = new NamedTaskHandler() {
            @Override
            public String taskType() {
                return "report";
            }

            @Override
            public boolean handle(JsonNode payload) {
                return true;
            }
        };
        when(namedHandlers.orderedStream()).thenReturn(Stream.of(report));

        HandlerRegistry withBeans = new HandlerRegistry(defaultHandler, namedHandlers);

        assertTrue(withBeans.hasHandler("report"));
        assertTrue(withBeans.process(task("report")).isSuccess());
    }
}
