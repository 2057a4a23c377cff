package com.taskq.gateway.controller;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.taskq.common.constants.QueueConstants;
import com.taskq.common.dto.EnqueueRequest;
import com.taskq.common.dto.EnqueueResponse;
import com.taskq.common.dto.QueueStats;
import com.taskq.common.model.TaskStatus;
import com.taskq.engine.StoreUnavailableException;
import com.taskq.engine.UnknownQueueException;
import com.taskq.engine.service.QueueEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Map;

@RestController
@RequestMapping("/api/queue")
@Tag(name = "Queue", description = "Enqueue tasks and inspect their progress")
public class QueueController {

    private static final Logger log = LoggerFactory.getLogger(QueueController.class);

    private final QueueEngine queueEngine;

    public QueueController(QueueEngine queueEngine) {
        this.queueEngine = queueEngine;
    }

    @Operation(summary = "Enqueue a task", description = "Stores the task and schedules it on the queue's priority tier. Returns 202 with the task id.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Task accepted"),
                    @ApiResponse(responseCode = "400", description = "Missing fields, malformed body, delay out of range or unknown queue"),
                    @ApiResponse(responseCode = "503", description = "Queue store unavailable")
            })
    @PostMapping("/enqueue")
    public ResponseEntity<?> enqueue(@RequestBody EnqueueRequest request) {
        if (isBlank(request.getQueueName()) || isBlank(request.getTaskType())) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "queue_name and task_type are required"));
        }
        if (request.getDelay() < 0) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "delay must not be negative"));
        }
        if (request.getDelay() > QueueConstants.MAX_DELAY_SECONDS) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "delay must not exceed " + QueueConstants.MAX_DELAY_SECONDS + " seconds"));
        }

        String taskId = queueEngine.enqueue(request.getQueueName(), request.getTaskType(),
                request.getTaskData() != null ? request.getTaskData() : JsonNodeFactory.instance.objectNode(),
                request.getPriority(), Duration.ofSeconds(request.getDelay()));

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new EnqueueResponse(taskId, request.getQueueName(), TaskStatus.PENDING.getValue()));
    }

    @Operation(summary = "Get task status", description = "Returns the stored task record. Finished tasks disappear once their retention window passes.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Task found"),
                    @ApiResponse(responseCode = "404", description = "Unknown or expired task id")
            })
    @GetMapping("/status/{taskId}")
    public ResponseEntity<?> getTaskStatus(@Parameter(description = "Task id returned by enqueue") @PathVariable String taskId) {
        return queueEngine.getTaskStatus(taskId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Task not found: " + taskId)));
    }

    @Operation(summary = "Queue statistics", description = "Task counts by status for every configured queue, or only queue_name when given.")
    @GetMapping("/stats")
    public ResponseEntity<Map<String, QueueStats>> getStats(
            @Parameter(description = "Restrict to one queue") @RequestParam(name = "queue_name", required = false) String queueName) {
        return ResponseEntity.ok(queueEngine.getQueueStats(queueName));
    }

    @Operation(summary = "Statistics for one queue",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Queue found"),
                    @ApiResponse(responseCode = "404", description = "Queue not configured")
            })
    @GetMapping("/stats/{queueName}")
    public ResponseEntity<?> getQueueStats(@PathVariable String queueName) {
        QueueStats stats = queueEngine.getQueueStats(queueName).get(queueName);
        if (stats == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Unknown queue: " + queueName));
        }
        return ResponseEntity.ok(stats);
    }

    @ExceptionHandler(UnknownQueueException.class)
    public ResponseEntity<Map<String, String>> handleUnknownQueue(UnknownQueueException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "Unknown queue: " + e.getQueueName()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.debug("Rejected unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", "Malformed request body: " + rootMessage(e)));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleStoreUnavailable(StoreUnavailableException e) {
        log.warn("Queue store unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "Queue store unavailable, retry later"));
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
