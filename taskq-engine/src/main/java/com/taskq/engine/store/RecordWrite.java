package com.taskq.engine.store;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One task record write plus the sorted-set changes for the same task id,
 * applied together by {@link TaskStore#apply(RecordWrite)}. Removals run before the insertion.
 */
public final class RecordWrite {

    private final String recordKey;
    private final String member;
    private final String recordJson;
    private final Duration ttl;
    private String scheduleKey;
    private double scheduleScore;
    private final List<String> unscheduleKeys = new ArrayList<>();

    private RecordWrite(String recordKey, String member, String recordJson, Duration ttl) {
        this.recordKey = Objects.requireNonNull(recordKey, "recordKey");
        this.member = Objects.requireNonNull(member, "member");
        this.recordJson = Objects.requireNonNull(recordJson, "recordJson");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
    }

    /**
     * @param member the task id, used as the sorted-set member for every schedule change
     */
    public static RecordWrite of(String recordKey, String member, String recordJson, Duration ttl) {
        return new RecordWrite(recordKey, member, recordJson, ttl);
    }

    public RecordWrite schedule(String key, double score) {
        this.scheduleKey = Objects.requireNonNull(key, "key");
        this.scheduleScore = score;
        return this;
    }

    public RecordWrite unschedule(String key) {
        unscheduleKeys.add(Objects.requireNonNull(key, "key"));
        return this;
    }

    public boolean hasSchedule() { return scheduleKey != null; }

    public String getRecordKey() { return recordKey; }
    public String getMember() { return member; }
    public String getRecordJson() { return recordJson; }
    public Duration getTtl() { return ttl; }
    public String getScheduleKey() { return scheduleKey; }
    public double getScheduleScore() { return scheduleScore; }
    public List<String> getUnscheduleKeys() { return Collections.unmodifiableList(unscheduleKeys); }
}
