package com.jasmin.trafficshield.services;

import com.jasmin.trafficshield.models.AnomalyRecord;
import com.jasmin.trafficshield.models.BlockRecord;
import com.jasmin.trafficshield.models.WindowMetrics;
import com.jasmin.trafficshield.store.BlockStore;
import com.jasmin.trafficshield.store.MetricsStore;
import com.jasmin.trafficshield.store.StoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Fire-and-forget writes to the block and metrics stores.
 * <p>
 * Writes run on the store executor. A failed or rejected write is kept in a bounded queue and
 * retried before the next write runs; when the queue is full the oldest pending write is dropped.
 */
@Slf4j
@Service
public class StoreWriter {

    private final BlockStore blockStore;
    private final MetricsStore metricsStore;
    private final TaskExecutor executor;
    private final int retryCapacity;
    private final Deque<PendingWrite> pending = new ArrayDeque<>();

    public StoreWriter(BlockStore blockStore,
                       MetricsStore metricsStore,
                       @Qualifier("storeExecutor") TaskExecutor executor,
                       StoreProperties props) {
        this.blockStore = blockStore;
        this.metricsStore = metricsStore;
        this.executor = executor;
        this.retryCapacity = props.getRetryCapacity();
    }

    public void upsertBlock(BlockRecord record) {
        BlockRecord copy = record.toBuilder().build();
        submit(new PendingWrite("upsert block " + copy.getSourceId(), () -> blockStore.upsert(copy)));
    }

    public void deleteBlock(String sourceId) {
        submit(new PendingWrite("delete block " + sourceId, () -> blockStore.delete(sourceId)));
    }

    public void appendMetrics(WindowMetrics metrics) {
        submit(new PendingWrite("append metrics " + metrics.getTimestamp(), () -> metricsStore.append(metrics)));
    }

    public void appendAnomaly(AnomalyRecord record) {
        submit(new PendingWrite("append anomaly " + record.getTimestamp(), () -> metricsStore.append(record)));
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    private void submit(PendingWrite write) {
        try {
            executor.execute(() -> {
                retryPending();
                run(write);
            });
        } catch (TaskRejectedException e) {
            log.warn("Store executor rejected {}, queued for retry", write.description);
            enqueue(write);
        }
    }

    private void retryPending() {
        int n;
        synchronized (this) {
            n = pending.size();
        }
        for (int i = 0; i < n; i++) {
            PendingWrite w;
            synchronized (this) {
                w = pending.pollFirst();
            }
            if (w == null) {
                return;
            }
            run(w);
        }
    }

    private void run(PendingWrite write) {
        try {
            write.action.run();
        } catch (RuntimeException e) {
            log.error("Store write failed: {}", write.description, e);
            enqueue(write);
        }
    }

    private synchronized void enqueue(PendingWrite write) {
        if (retryCapacity == 0) {
            return;
        }
        while (pending.size() >= retryCapacity) {
            PendingWrite dropped = pending.pollFirst();
            log.warn("Retry queue full, dropping {}", dropped.description);
        }
        pending.addLast(write);
    }

    private static final class PendingWrite {
        private final String description;
        private final Runnable action;

        private PendingWrite(String description, Runnable action) {
            this.description = description;
            this.action = action;
        }
    }
}
