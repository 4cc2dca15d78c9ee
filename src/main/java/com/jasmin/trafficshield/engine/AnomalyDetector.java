package com.jasmin.trafficshield.engine;

import com.jasmin.trafficshield.constants.Constants;
import com.jasmin.trafficshield.detectors.Detector;
import com.jasmin.trafficshield.models.AnomalyRecord;
import com.jasmin.trafficshield.models.WindowMetrics;
import com.jasmin.trafficshield.services.StoreWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Blends the weighted detector sub-scores into one anomaly score per snapshot and keeps a
 * bounded history of the results.
 */
@Slf4j
@Service
public class AnomalyDetector {

    private final List<Detector> detectors;
    private final AnomalyDetectorProperties props;
    private final StoreWriter storeWriter;
    private final Clock clock;

    private final Deque<AnomalyRecord> history = new ArrayDeque<>();
    private double latestScore;

    public AnomalyDetector(List<Detector> detectors,
                           AnomalyDetectorProperties props,
                           StoreWriter storeWriter,
                           Clock clock) {
        this.detectors = detectors;
        this.props = props;
        this.storeWriter = storeWriter;
        this.clock = clock;
    }

    /**
     * Scores one snapshot. Never throws: a failing detector contributes 0.
     *
     * @return anomaly score in [0,1]
     */
    public synchronized double detect(WindowMetrics metrics) {
        Map<String, Double> subScores = new HashMap<>();
        double total = 0.0;
        for (Detector detector : detectors) {
            double s;
            try {
                s = Detector.clamp01(detector.score(metrics));
            } catch (RuntimeException e) {
                log.error("Detector {} failed, scoring 0", detector.name(), e);
                s = 0.0;
            }
            subScores.put(detector.name(), s);
            total += detector.weight() * s;
        }
        double score = Detector.clamp01(total);

        AnomalyRecord record = AnomalyRecord.builder()
                .timestamp(metrics.getTimestamp())
                .anomalyScore(score)
                .entropyScore(subScores.getOrDefault(Constants.ENTROPY_DETECTOR, 0.0))
                .burstScore(subScores.getOrDefault(Constants.BURST_DETECTOR, 0.0))
                .outlierScore(subScores.getOrDefault(Constants.OUTLIER_DETECTOR, 0.0))
                .entropy(metrics.getEntropy())
                .burst(metrics.getBurstScore())
                .uniqueSources(metrics.getUniqueSources())
                .totalRequests(metrics.getTotalRequests())
                .build();
        history.addLast(record);
        while (history.size() > props.getHistoryCapacity()) {
            history.pollFirst();
        }
        latestScore = score;

        if (score >= props.getPersistMinScore()) {
            storeWriter.appendAnomaly(record);
        }
        log.debug("Anomaly score {} at {} ({})", score, metrics.getTimestamp(), subScores);
        return score;
    }

    /** Records whose snapshot is newer than {@code now - duration}. */
    public synchronized List<AnomalyRecord> getRecentAnomalies(Duration duration) {
        Instant cutoff = clock.instant().minus(duration);
        return history.stream()
                .filter(r -> r.getTimestamp().isAfter(cutoff))
                .collect(Collectors.toList());
    }

    public synchronized double getLatestScore() {
        return latestScore;
    }

    /** Clears the history and every detector's rolling state. */
    public synchronized void reset() {
        history.clear();
        latestScore = 0.0;
        detectors.forEach(Detector::reset);
        log.info("Anomaly detector reset");
    }
}
