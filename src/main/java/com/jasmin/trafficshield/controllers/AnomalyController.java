package com.jasmin.trafficshield.controllers;

import com.jasmin.trafficshield.engine.AnomalyDetector;
import com.jasmin.trafficshield.models.AnomalyRecord;
import com.jasmin.trafficshield.services.TrafficShieldService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/anomalies")
@RequiredArgsConstructor
public class AnomalyController {

    private final AnomalyDetector anomalyDetector;
    private final TrafficShieldService trafficShieldService;

    @GetMapping
    public List<AnomalyRecord> recent(@RequestParam(defaultValue = "5") int minutes) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("minutes must be positive");
        }
        return anomalyDetector.getRecentAnomalies(Duration.ofMinutes(minutes));
    }

    /** Resets detection together with the profiler and mitigation state it feeds. */
    @PostMapping("/reset")
    public ResponseEntity<Void> reset() {
        trafficShieldService.reset();
        return ResponseEntity.noContent().build();
    }
}
