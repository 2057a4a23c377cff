package com.taskq.engine.handler;

/**
 * A {@link TaskHandler} bean that registers itself for {@link #taskType()} at startup.
 */
public interface NamedTaskHandler extends TaskHandler {

    String taskType();
}
