package com.taskq.common.constants;

import com.taskq.common.model.TaskPriority;

import java.time.Instant;

public final class QueueConstants {

    private QueueConstants() {}

    public static final String KEY_PREFIX = "queue:";
    public static final String TASK_KEY_PREFIX = "queue:task:";
    public static final String TASK_KEY_PATTERN = "queue:task:*";

    public static final String QUEUE_DEFAULT = "default";
    public static final String QUEUE_HIGH_PRIORITY = "high_priority";
    public static final String QUEUE_LOW_PRIORITY = "low_priority";

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long BACKOFF_BASE_SECONDS = 60;
    public static final long BACKOFF_MAX_SECONDS = 3600;

    /** Longest accepted enqueue delay: one year. */
    public static final long MAX_DELAY_SECONDS = 365L * 24 * 3600;

    public static String taskKey(String taskId) {
        return TASK_KEY_PREFIX + taskId;
    }

    public static String readyKey(String queue, TaskPriority priority) {
        return KEY_PREFIX + queue + ":" + priority.tierName();
    }

    public static String leaseKey(String queue) {
        return KEY_PREFIX + queue + ":processing";
    }

    public static String enqueuedCounterKey(String queue) {
        return KEY_PREFIX + queue + ":enqueued";
    }

    public static long backoffSeconds(int attempts) {
        return backoffSeconds(attempts, BACKOFF_BASE_SECONDS, BACKOFF_MAX_SECONDS);
    }

    /** {@code min(base * 2^attempts, max)}, saturating instead of overflowing. */
    public static long backoffSeconds(int attempts, long baseSeconds, long maxSeconds) {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0");
        }
        if (attempts >= 62 || baseSeconds > (maxSeconds >> Math.min(attempts, 62))) {
            return maxSeconds;
        }
        return Math.min(baseSeconds << attempts, maxSeconds);
    }

    /** Store score for an instant: Unix seconds with millisecond precision. */
    public static double score(Instant instant) {
        return instant.toEpochMilli() / 1000.0;
    }
}
