package com.taskq.engine.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskq.common.constants.QueueConstants;
import com.taskq.common.model.TaskPriority;
import com.taskq.common.model.TaskRecord;
import com.taskq.common.model.TaskStatus;
import com.taskq.engine.config.TaskQueueProperties;
import com.taskq.engine.handler.DataSink;
import com.taskq.engine.handler.DefaultCrudHandler;
import com.taskq.engine.handler.HandlerRegistry;
import com.taskq.engine.handler.NamedTaskHandler;
import com.taskq.engine.service.QueueEngine;
import com.taskq.engine.service.TaskRecordCodec;
import com.taskq.engine.support.EngineFixtures;
import com.taskq.engine.support.InMemoryTaskStore;
import com.taskq.engine.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Worker, registry and engine wired against the in-memory store.
 */
class WorkerScenarioTest {

    private static final String DEFAULT = QueueConstants.QUEUE_DEFAULT;

    private final ObjectMapper objectMapper = EngineFixtures.objectMapper();
    private MutableClock clock;
    private TaskQueueProperties properties;
    private QueueEngine engine;
    private HandlerRegistry registry;
    private DataSink dataSink;
    private WorkerPool pool;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        properties = EngineFixtures.properties();
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        engine = new QueueEngine(new InMemoryTaskStore(clock), new TaskRecordCodec(objectMapper),
                properties, clock, meterRegistry);

        dataSink = mock(DataSink.class);
        ObjectProvider<NamedTaskHandler> none = mock(ObjectProvider.class);
        when(none.orderedStream()).thenReturn(Stream.empty());
        registry = new HandlerRegistry(new DefaultCrudHandler(dataSink, objectMapper, clock), none);
        pool = new WorkerPool(engine, registry, properties, meterRegistry);
    }

    @Test
    void registeredHandlerCompletesTaskInOneCycle() throws Exception {
        registry.register("custom", payload -> payload.get("ok").asBoolean());
        String id = engine.enqueue(DEFAULT, "custom", objectMapper.readTree("{\"ok\":true}"));

        assertTrue(pool.runOnce(DEFAULT, "default-worker-0"));

        assertEquals(TaskStatus.COMPLETED, engine.getTaskStatus(id).orElseThrow().getStatus());
    }

    @Test
    void failingHandlerIsRetriedWithBackoffThenFails() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        registry.register("flaky", payload -> {
            calls.incrementAndGet();
            throw new IllegalStateException("upstream 503");
        });
        String id = engine.enqueue(DEFAULT, "flaky", objectMapper.readTree("{}"));

        assertTrue(pool.runOnce(DEFAULT, "default-worker-0"));
        assertEquals(TaskStatus.RETRY, engine.getTaskStatus(id).orElseThrow().getStatus());
        assertFalse(pool.runOnce(DEFAULT, "default-worker-0"));

        clock.advance(Duration.ofSeconds(120));
        assertTrue(pool.runOnce(DEFAULT, "default-worker-0"));
        clock.advance(Duration.ofSeconds(240));
        assertTrue(pool.runOnce(DEFAULT, "default-worker-0"));

        TaskRecord record = engine.getTaskStatus(id).orElseThrow();
        assertEquals(TaskStatus.FAILED, record.getStatus());
        assertEquals(3, record.getAttempts());
        assertTrue(record.getLastError().contains("upstream 503"));
        assertEquals(3, calls.get());

        clock.advance(Duration.ofHours(1));
        assertFalse(pool.runOnce(DEFAULT, "default-worker-0"));
    }

    @Test
    void unregisteredTypeGoesThroughCrudHandler() throws Exception {
        when(dataSink.insert(eq("orders"), any())).thenReturn("doc-9");
        String id = engine.enqueue(DEFAULT, "db_operation", objectMapper.readTree(
                "{\"operation\":\"insert\",\"collection\":\"orders\",\"data\":{\"total\":12}}"), TaskPriority.HIGH);

        assertTrue(pool.runOnce(DEFAULT, "default-worker-0"));

        TaskRecord record = engine.getTaskStatus(id).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, record.getStatus());
        assertEquals("doc-9", record.getResult().get("inserted_id").asText());
    }

    @Test
    void invalidCrudPayloadConsumesAttempt() throws Exception {
        String id = engine.enqueue(DEFAULT, "db_operation", objectMapper.readTree("{\"collection\":\"orders\"}"));

        pool.runOnce(DEFAULT, "default-worker-0");

        TaskRecord record = engine.getTaskStatus(id).orElseThrow();
        assertEquals(TaskStatus.RETRY, record.getStatus());
        assertEquals(1, record.getAttempts());
        verifyNoInteractions(dataSink);
    }

    @Test
    void startedPoolDrainsQueue() throws Exception {
        properties.getWorker().setPollInterval(Duration.ofMillis(10));
        AtomicInteger handled = new AtomicInteger();
        registry.register("noop", payload -> handled.incrementAndGet() > 0);
        for (int i = 0; i < 10; i++) {
            engine.enqueue(DEFAULT, "noop", objectMapper.readTree("{}"));
        }

        pool.startWorkers();
        try {
            long deadline = System.currentTimeMillis() + 5000;
            while (handled.get() < 10 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
        } finally {
            pool.stopWorkers();
        }

        assertEquals(10, handled.get());
        assertEquals(10, engine.getQueueStats(DEFAULT).get(DEFAULT).getCompleted());
    }

    @Test
    void leaseReaperReturnsAbandonedTaskToQueue() throws Exception {
        String id = engine.enqueue(DEFAULT, "noop", objectMapper.readTree("{}"));
        engine.dequeue(DEFAULT);
        LeaseReaper reaper = new LeaseReaper(engine);

        assertEquals(0, reaper.reclaimAll());
        clock.advance(properties.getLease().getDuration());
        assertEquals(1, reaper.reclaimAll());

        assertEquals(TaskStatus.RETRY, engine.getTaskStatus(id).orElseThrow().getStatus());
    }
}
