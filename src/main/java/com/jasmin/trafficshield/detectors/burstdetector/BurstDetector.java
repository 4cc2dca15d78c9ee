package com.jasmin.trafficshield.detectors.burstdetector;

import com.jasmin.trafficshield.constants.Constants;
import com.jasmin.trafficshield.detectors.Detector;
import com.jasmin.trafficshield.models.WindowMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BurstDetector implements Detector {

    private final BurstProperties cfg;

    @Override
    public String name() {
        return Constants.BURST_DETECTOR;
    }

    @Override
    public double weight() {
        return cfg.getWeight();
    }

    @Override
    public double score(WindowMetrics metrics) {
        double b = metrics.getBurstScore();
        if (b <= cfg.getThreshold()) {
            return 0.0;
        }
        double span = cfg.getMaxBurst() - cfg.getThreshold();
        return span <= 0 ? 1.0 : Detector.clamp01((b - cfg.getThreshold()) / span);
    }
}
