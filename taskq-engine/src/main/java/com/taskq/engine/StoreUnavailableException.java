package com.taskq.engine;

/**
 * The backing store could not be reached or rejected a command.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
