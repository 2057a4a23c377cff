package com.taskq.engine.store;

import com.taskq.engine.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

@Component
public class RedisTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(RedisTaskStore.class);

    private static final long SCAN_COUNT = 500;

    // KEYS[1] record, KEYS[2] schedule set or '', KEYS[3..n] sets to remove the member from
    // ARGV[1] json, ARGV[2] ttl millis, ARGV[3] schedule score, ARGV[4] member
    private static final String APPLY_SCRIPT = """
            redis.call('SET', KEYS[1], ARGV[1], 'PX', ARGV[2])
            for i = 3, #KEYS do
                redis.call('ZREM', KEYS[i], ARGV[4])
            end
            if KEYS[2] ~= '' then
                redis.call('ZADD', KEYS[2], ARGV[3], ARGV[4])
            end
            return 1
            """;

    // KEYS[1] lease set, KEYS[2] record; ARGV[1] score, ARGV[2] member, ARGV[3] record ttl millis
    private static final String RESCORE_SCRIPT = """
            if redis.call('ZSCORE', KEYS[1], ARGV[2]) then
                redis.call('ZADD', KEYS[1], ARGV[1], ARGV[2])
                redis.call('PEXPIRE', KEYS[2], ARGV[3])
                return 1
            end
            return 0
            """;

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> applyScript;
    private final DefaultRedisScript<Long> rescoreScript;

    public RedisTaskStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.applyScript = new DefaultRedisScript<>(APPLY_SCRIPT, Long.class);
        this.rescoreScript = new DefaultRedisScript<>(RESCORE_SCRIPT, Long.class);
    }

    @Override
    public Optional<String> get(String key) {
        return call("GET " + key, () -> Optional.ofNullable(redisTemplate.opsForValue().get(key)));
    }

    @Override
    public List<String> multiGet(List<String> keys) {
        if (keys.isEmpty()) {
            return Collections.emptyList();
        }
        return call("MGET", () -> {
            List<String> values = redisTemplate.opsForValue().multiGet(keys);
            return values != null ? values : Collections.<String>nCopies(keys.size(), null);
        });
    }

    @Override
    public long increment(String key) {
        return call("INCR " + key, () -> {
            Long value = redisTemplate.opsForValue().increment(key);
            return value != null ? value : 0L;
        });
    }

    @Override
    public List<String> scanKeys(String pattern) {
        return call("SCAN " + pattern, () -> redisTemplate.execute((RedisCallback<List<String>>) connection -> {
            List<String> keys = new ArrayList<>();
            ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_COUNT).build();
            try (Cursor<byte[]> cursor = connection.keyCommands().scan(options)) {
                while (cursor.hasNext()) {
                    keys.add(new String(cursor.next(), StandardCharsets.UTF_8));
                }
            }
            return keys;
        }));
    }

    @Override
    public List<String> rangeByScore(String key, double min, double max, long offset, long count) {
        return call("ZRANGEBYSCORE " + key, () -> {
            Set<String> members = redisTemplate.opsForZSet().rangeByScore(key, min, max, offset, count);
            return members != null ? new ArrayList<>(members) : Collections.<String>emptyList();
        });
    }

    @Override
    public long removeScored(String key, String member) {
        return call("ZREM " + key, () -> {
            Long removed = redisTemplate.opsForZSet().remove(key, member);
            return removed != null ? removed : 0L;
        });
    }

    @Override
    public long countScored(String key) {
        return call("ZCARD " + key, () -> {
            Long size = redisTemplate.opsForZSet().zCard(key);
            return size != null ? size : 0L;
        });
    }

    @Override
    public boolean rescoreIfPresent(String key, String member, double score, String recordKey, Duration recordTtl) {
        return call("RESCORE " + key, () -> {
            Long updated = redisTemplate.execute(rescoreScript, List.of(key, recordKey),
                    Double.toString(score), member, Long.toString(Math.max(1, recordTtl.toMillis())));
            return updated != null && updated == 1L;
        });
    }

    @Override
    public void apply(RecordWrite write) {
        List<String> keys = new ArrayList<>();
        keys.add(write.getRecordKey());
        keys.add(write.hasSchedule() ? write.getScheduleKey() : "");
        keys.addAll(write.getUnscheduleKeys());
        call("APPLY " + write.getRecordKey(), () -> redisTemplate.execute(applyScript, keys,
                write.getRecordJson(),
                Long.toString(Math.max(1, write.getTtl().toMillis())),
                Double.toString(write.getScheduleScore()),
                write.getMember()));
    }

    private <T> T call(String command, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.warn("Redis command failed: {}: {}", command, e.getMessage());
            throw new StoreUnavailableException("Redis command failed: " + command, e);
        }
    }
}
