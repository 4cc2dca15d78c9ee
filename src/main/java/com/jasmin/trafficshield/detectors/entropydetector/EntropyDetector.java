package com.jasmin.trafficshield.detectors.entropydetector;

import com.jasmin.trafficshield.constants.Constants;
import com.jasmin.trafficshield.detectors.Detector;
import com.jasmin.trafficshield.models.WindowMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Flags source distributions that are either too concentrated (one flooding source) or too
 * even across many sources (distributed flood).
 */
@Service
@RequiredArgsConstructor
public class EntropyDetector implements Detector {

    private final EntropyProperties cfg;

    @Override
    public String name() {
        return Constants.ENTROPY_DETECTOR;
    }

    @Override
    public double weight() {
        return cfg.getWeight();
    }

    @Override
    public double score(WindowMetrics metrics) {
        if (metrics.getTotalRequests() == 0) {
            return 0.0;
        }
        double h = metrics.getEntropy();
        if (h < cfg.getLowThreshold()) {
            return Detector.clamp01(1.0 - h);
        }
        if (h > cfg.getHighThreshold()) {
            double span = cfg.getMaxEntropy() - cfg.getHighThreshold();
            return span <= 0 ? 1.0 : Detector.clamp01((h - cfg.getHighThreshold()) / span);
        }
        return 0.0;
    }
}
