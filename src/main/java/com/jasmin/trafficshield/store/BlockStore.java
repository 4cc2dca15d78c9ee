package com.jasmin.trafficshield.store;

import com.jasmin.trafficshield.models.BlockRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable copy of block records. Implementations signal failures with
 * {@link com.jasmin.trafficshield.exceptions.PersistenceException}.
 */
public interface BlockStore {

    /** Inserts or replaces the record for its source. */
    void upsert(BlockRecord record);

    Optional<BlockRecord> get(String sourceId);

    /** Records that are permanent or expire after {@code now}. */
    List<BlockRecord> listActive(Instant now);

    void delete(String sourceId);
}
