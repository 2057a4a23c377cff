package com.taskq.engine.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Networked key-value store holding task records and the sorted sets used as
 * ready-sets and lease sets. Implementations throw
 * {@link com.taskq.engine.StoreUnavailableException} on connectivity faults.
 */
public interface TaskStore {

    Optional<String> get(String key);

    /** Values for {@code keys} in order; entries for missing keys are {@code null}. */
    List<String> multiGet(List<String> keys);

    long increment(String key);

    /** Keys matching a glob pattern, e.g. {@code queue:task:*}. */
    List<String> scanKeys(String pattern);

    /** Members with {@code min <= score <= max}, lowest score first. */
    List<String> rangeByScore(String key, double min, double max, long offset, long count);

    /** @return number of members actually removed, 0 if another caller removed it first */
    long removeScored(String key, String member);

    long countScored(String key);

    /**
     * Updates the score of {@code member} only if it is still in the set, and in the same step
     * resets the expiry of {@code recordKey} to {@code recordTtl}.
     */
    boolean rescoreIfPresent(String key, String member, double score, String recordKey, Duration recordTtl);

    /** Applies a record write and its sorted-set changes as one atomic unit. */
    void apply(RecordWrite write);
}
