package com.jasmin.trafficshield.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.trafficshield.constants.Constants;
import com.jasmin.trafficshield.exceptions.PersistenceException;
import com.jasmin.trafficshield.models.AnomalyRecord;
import com.jasmin.trafficshield.models.WindowMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/** Appends snapshots and anomaly records to two capped Redis streams. */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "store", name = "type", havingValue = Constants.STORE_REDIS)
public class RedisMetricsStore implements MetricsStore {

    private final StringRedisTemplate redis;
    private final StoreProperties props;
    private final ObjectMapper objectMapper;

    @Override
    public void append(WindowMetrics m) {
        Map<String, String> data = new HashMap<>();
        data.put("timestamp", m.getTimestamp().toString());
        data.put("rps", Double.toString(m.getRequestsPerSecond()));
        data.put("uniqueSources", Integer.toString(m.getUniqueSources()));
        data.put("payload", toJson(m));
        add(props.getKeyPrefix() + ":metrics", data);
    }

    @Override
    public void append(AnomalyRecord r) {
        Map<String, String> data = new HashMap<>();
        data.put("timestamp", r.getTimestamp().toString());
        data.put("score", Double.toString(r.getAnomalyScore()));
        data.put("payload", toJson(r));
        add(props.getKeyPrefix() + ":anomalies", data);
    }

    private void add(String stream, Map<String, String> data) {
        try {
            redis.opsForStream().add(stream, data);
            redis.opsForStream().trim(stream, props.getMetricsStreamMaxLen(), true);
        } catch (RuntimeException e) {
            throw new PersistenceException("Could not append to " + stream, e);
        }
    }

    private String toJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Could not serialize " + o.getClass().getSimpleName(), e);
        }
    }
}
