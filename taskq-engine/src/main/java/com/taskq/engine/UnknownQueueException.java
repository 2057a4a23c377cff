package com.taskq.engine;

/**
 * Raised when a producer targets a queue that is not declared under {@code taskq.queues}.
 */
public class UnknownQueueException extends RuntimeException {

    private final String queueName;

    public UnknownQueueException(String queueName) {
        super("Unknown queue: " + queueName);
        this.queueName = queueName;
    }

    public String getQueueName() { return queueName; }
}
