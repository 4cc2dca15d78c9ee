package com.jasmin.trafficshield.store;

import com.jasmin.trafficshield.constants.Constants;
import com.jasmin.trafficshield.exceptions.PersistenceException;
import com.jasmin.trafficshield.models.BlockRecord;
import com.jasmin.trafficshield.models.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One hash per blocked source plus a sorted-set index scored by expiry (permanent blocks use
 * {@link #PERMANENT_SCORE}).
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "store", name = "type", havingValue = Constants.STORE_REDIS)
public class RedisBlockStore implements BlockStore {

    private static final double PERMANENT_SCORE = (double) Long.MAX_VALUE;

    private final StringRedisTemplate redis;
    private final StoreProperties props;
    private final Clock clock;

    @Override
    public void upsert(BlockRecord r) {
        try {
            Map<String, String> h = new LinkedHashMap<>();
            h.put("sourceId", r.getSourceId());
            h.put("severity", r.getSeverity().name());
            h.put("blockedAt", Long.toString(r.getBlockedAt().toEpochMilli()));
            h.put("expiresAt", r.getExpiresAt() == null ? "" : Long.toString(r.getExpiresAt().toEpochMilli()));
            h.put("reason", r.getReason() == null ? "" : r.getReason());
            h.put("lowTrust", Boolean.toString(r.isLowTrust()));

            String key = recordKey(r.getSourceId());
            redis.delete(key);
            redis.opsForHash().putAll(key, h);
            if (r.getExpiresAt() != null) {
                Duration ttl = Duration.between(clock.instant(), r.getExpiresAt());
                if (!ttl.isNegative() && !ttl.isZero()) {
                    redis.expire(key, ttl);
                }
            }
            double score = r.getExpiresAt() == null ? PERMANENT_SCORE : r.getExpiresAt().toEpochMilli();
            redis.opsForZSet().add(indexKey(), key, score);
        } catch (RuntimeException e) {
            throw new PersistenceException("Could not store block for " + r.getSourceId(), e);
        }
    }

    @Override
    public Optional<BlockRecord> get(String sourceId) {
        try {
            return read(recordKey(sourceId));
        } catch (RuntimeException e) {
            throw new PersistenceException("Could not read block for " + sourceId, e);
        }
    }

    @Override
    public List<BlockRecord> listActive(Instant now) {
        try {
            Set<String> keys = redis.opsForZSet().rangeByScore(indexKey(), now.toEpochMilli() + 1, PERMANENT_SCORE);
            List<BlockRecord> out = new ArrayList<>();
            if (keys == null) {
                return out;
            }
            for (String key : keys) {
                read(key).filter(r -> r.isActive(now)).ifPresent(out::add);
            }
            return out;
        } catch (RuntimeException e) {
            throw new PersistenceException("Could not list active blocks", e);
        }
    }

    @Override
    public void delete(String sourceId) {
        try {
            String key = recordKey(sourceId);
            redis.delete(key);
            redis.opsForZSet().remove(indexKey(), key);
        } catch (RuntimeException e) {
            throw new PersistenceException("Could not delete block for " + sourceId, e);
        }
    }

    private Optional<BlockRecord> read(String key) {
        Map<Object, Object> h = redis.opsForHash().entries(key);
        if (h == null || h.isEmpty()) {
            return Optional.empty();
        }
        String expires = str(h.get("expiresAt"));
        return Optional.of(BlockRecord.builder()
                .sourceId(str(h.get("sourceId")))
                .severity(Severity.valueOf(str(h.get("severity"))))
                .blockedAt(Instant.ofEpochMilli(Long.parseLong(str(h.get("blockedAt")))))
                .expiresAt(expires.isEmpty() ? null : Instant.ofEpochMilli(Long.parseLong(expires)))
                .reason(str(h.get("reason")))
                .lowTrust(Boolean.parseBoolean(str(h.get("lowTrust"))))
                .build());
    }

    private String recordKey(String sourceId) {
        return props.getKeyPrefix() + ":block:" + sourceId;
    }

    private String indexKey() {
        return props.getKeyPrefix() + ":blocks:index";
    }

    private static String str(Object o) {
        return o == null ? "" : o.toString();
    }
}
