package com.jasmin.trafficshield.detectors.outlierdetector;

import com.jasmin.trafficshield.constants.Constants;
import com.jasmin.trafficshield.detectors.Detector;
import com.jasmin.trafficshield.exceptions.ModelException;
import com.jasmin.trafficshield.models.WindowMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/**
 * Scores each snapshot against an {@link IsolationForest} trained on the recent snapshots.
 * Model failures are logged and score 0.
 */
@Slf4j
@Service
public class OutlierDetector implements Detector {

    private final OutlierProperties cfg;
    private final Deque<double[]> buffer = new ArrayDeque<>();
    private IsolationForest model;
    private int samplesSinceFit;

    public OutlierDetector(OutlierProperties cfg) {
        this.cfg = cfg;
    }

    @Override
    public String name() {
        return Constants.OUTLIER_DETECTOR;
    }

    @Override
    public double weight() {
        return cfg.getWeight();
    }

    @Override
    public synchronized double score(WindowMetrics metrics) {
        try {
            double[] x = metrics.features();
            for (double v : x) {
                if (!Double.isFinite(v)) {
                    throw new ModelException("Non-finite feature in snapshot " + metrics.getTimestamp());
                }
            }

            buffer.addLast(x);
            while (buffer.size() > cfg.getBufferSize()) {
                buffer.pollFirst();
            }
            samplesSinceFit++;
            if (buffer.size() < cfg.getMinSamples()) {
                return 0.0;
            }
            if (model == null || samplesSinceFit >= cfg.getRefitEvery()) {
                model = IsolationForest.fit(new ArrayList<>(buffer), cfg.getTrees(), cfg.getSampleSize(), cfg.getSeed());
                samplesSinceFit = 0;
                log.info("Outlier model fitted on {} samples", buffer.size());
            }
            double s = model.score(x);
            return Detector.clamp01((s - 0.5) / 0.5);
        } catch (ModelException e) {
            log.error("Outlier model failed, scoring 0: {}", e.getMessage());
            return 0.0;
        } catch (RuntimeException e) {
            log.error("Unexpected outlier model failure, scoring 0", e);
            return 0.0;
        }
    }

    public synchronized boolean isFitted() {
        return model != null;
    }

    public synchronized int bufferedSamples() {
        return buffer.size();
    }

    @Override
    public synchronized void reset() {
        buffer.clear();
        model = null;
        samplesSinceFit = 0;
    }
}
