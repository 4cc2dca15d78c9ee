package com.jasmin.trafficshield.store;

import com.jasmin.trafficshield.constants.Constants;
import com.jasmin.trafficshield.models.BlockRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(prefix = "store", name = "type", havingValue = Constants.STORE_MEMORY, matchIfMissing = true)
public class InMemoryBlockStore implements BlockStore {

    private final Map<String, BlockRecord> records = new ConcurrentHashMap<>();

    @Override
    public void upsert(BlockRecord record) {
        records.put(record.getSourceId(), record.toBuilder().build());
    }

    @Override
    public Optional<BlockRecord> get(String sourceId) {
        return Optional.ofNullable(records.get(sourceId)).map(r -> r.toBuilder().build());
    }

    @Override
    public List<BlockRecord> listActive(Instant now) {
        return records.values().stream()
                .filter(r -> r.isActive(now))
                .map(r -> r.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public void delete(String sourceId) {
        records.remove(sourceId);
    }

    public int size() {
        return records.size();
    }
}
