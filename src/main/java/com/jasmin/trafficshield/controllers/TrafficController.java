package com.jasmin.trafficshield.controllers;

import com.jasmin.trafficshield.models.MitigationVerdict;
import com.jasmin.trafficshield.models.RequestEvent;
import com.jasmin.trafficshield.models.WindowMetrics;
import com.jasmin.trafficshield.profiler.TrafficProfiler;
import com.jasmin.trafficshield.services.TrafficShieldService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/traffic")
@RequiredArgsConstructor
public class TrafficController {

    private final TrafficShieldService trafficShieldService;
    private final TrafficProfiler trafficProfiler;

    @PostMapping("/events")
    public MitigationVerdict ingest(@Valid @RequestBody RequestEvent event) {
        return trafficShieldService.handle(event);
    }

    @GetMapping("/metrics/current")
    public WindowMetrics current() {
        return trafficProfiler.getCurrentMetrics();
    }

    @GetMapping("/metrics/history")
    public List<WindowMetrics> history(@RequestParam(defaultValue = "5") int minutes) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("minutes must be positive");
        }
        List<WindowMetrics> out = new ArrayList<>();
        trafficProfiler.getHistory(Duration.ofMinutes(minutes)).forEach(out::add);
        return out;
    }
}
