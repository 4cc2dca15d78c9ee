package com.jasmin.trafficshield.store;

import com.jasmin.trafficshield.constants.Constants;
import com.jasmin.trafficshield.models.AnomalyRecord;
import com.jasmin.trafficshield.models.WindowMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Bounded ring of the most recent snapshots and anomaly records. */
@Component
@ConditionalOnProperty(prefix = "store", name = "type", havingValue = Constants.STORE_MEMORY, matchIfMissing = true)
public class InMemoryMetricsStore implements MetricsStore {

    private final int capacity;
    private final Deque<WindowMetrics> metrics = new ArrayDeque<>();
    private final Deque<AnomalyRecord> anomalies = new ArrayDeque<>();

    public InMemoryMetricsStore(StoreProperties props) {
        this.capacity = props.getMemoryCapacity();
    }

    @Override
    public synchronized void append(WindowMetrics m) {
        metrics.addLast(m);
        while (metrics.size() > capacity) {
            metrics.pollFirst();
        }
    }

    @Override
    public synchronized void append(AnomalyRecord r) {
        anomalies.addLast(r);
        while (anomalies.size() > capacity) {
            anomalies.pollFirst();
        }
    }

    public synchronized List<WindowMetrics> metrics() {
        return new ArrayList<>(metrics);
    }

    public synchronized List<AnomalyRecord> anomalies() {
        return new ArrayList<>(anomalies);
    }
}
