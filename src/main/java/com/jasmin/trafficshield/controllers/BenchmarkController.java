package com.jasmin.trafficshield.controllers;

import com.jasmin.trafficshield.benchmark.BenchmarkReport;
import com.jasmin.trafficshield.benchmark.BenchmarkRequest;
import com.jasmin.trafficshield.benchmark.DetectionBenchmark;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class BenchmarkController {

    private final DetectionBenchmark detectionBenchmark;

    @PostMapping("/benchmark")
    public BenchmarkReport run(@Valid @RequestBody BenchmarkRequest request) {
        return detectionBenchmark.run(request);
    }
}
