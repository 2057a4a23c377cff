package com.taskq.engine.handler;

import com.taskq.common.model.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes a task to the handler registered for its type, falling back to {@link DefaultCrudHandler}.
 */
@Component
public class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();
    private final DefaultCrudHandler defaultHandler;

    public HandlerRegistry(DefaultCrudHandler defaultHandler, ObjectProvider<NamedTaskHandler> namedHandlers) {
        this.defaultHandler = defaultHandler;
        namedHandlers.orderedStream().forEach(h -> register(h.taskType(), h));
    }

    /** Adds or replaces the handler for {@code taskType}. */
    public void register(String taskType, TaskHandler handler) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType is required");
        }
        TaskHandler previous = handlers.put(taskType, handler);
        if (previous != null) {
            log.info("Replaced handler for task type: {}", taskType);
        } else {
            log.info("Registered handler for task type: {}", taskType);
        }
    }

    public boolean hasHandler(String taskType) {
        return handlers.containsKey(taskType);
    }

    /**
     * Runs the handler for {@code task}. Exceptions thrown by the handler propagate to the caller.
     */
    public TaskOutcome process(TaskRecord task) throws Exception {
        TaskHandler handler = handlers.get(task.getType());
        if (handler == null) {
            return defaultHandler.handle(task.getPayload());
        }
        if (handler.handle(task.getPayload())) {
            return TaskOutcome.success();
        }
        return TaskOutcome.failure("Handler for task type '" + task.getType() + "' reported failure");
    }
}
