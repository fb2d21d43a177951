package com.fieldforce.fieldexecutionbackend.store;

import com.fieldforce.fieldexecutionbackend.config.FieldExecutionProperties;
import com.fieldforce.fieldexecutionbackend.model.ProgressRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed progress store. Records expire after the configured TTL so an abandoned visit
 * does not linger forever.
 */
@Slf4j
@Component
@Profile("redis")
public class RedisProgressStore implements ProgressStore {

    static final String KEY_PREFIX = "progress:";

    private final RedisTemplate<String, ProgressRecord> progressRedisTemplate;
    private final Duration ttl;

    public RedisProgressStore(RedisTemplate<String, ProgressRecord> progressRedisTemplate,
                              FieldExecutionProperties properties) {
        this.progressRedisTemplate = progressRedisTemplate;
        this.ttl = properties.getProgress().getRedisTtl();
    }

    private String key(String unitId) {
        return KEY_PREFIX + unitId;
    }

    @Override
    public Optional<ProgressRecord> load(String unitId) {
        return Optional.ofNullable(progressRedisTemplate.opsForValue().get(key(unitId)));
    }

    @Override
    public ProgressRecord save(ProgressRecord record) {
        record.touch();
        progressRedisTemplate.opsForValue().set(key(record.getUnitId()), record, ttl);
        return record;
    }

    @Override
    public void purge(String unitId) {
        progressRedisTemplate.delete(key(unitId));
        log.debug("Purged progress record {}", unitId);
    }
}
