package com.taskq.engine;

public class TaskCodecException extends RuntimeException {

    public TaskCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
