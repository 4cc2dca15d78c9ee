package com.jasmin.trafficshield.controllers;

import com.jasmin.trafficshield.mitigation.CleanupReport;
import com.jasmin.trafficshield.mitigation.MitigationEngine;
import com.jasmin.trafficshield.mitigation.MitigationStatus;
import com.jasmin.trafficshield.models.BlockRecord;
import com.jasmin.trafficshield.models.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/mitigation")
@RequiredArgsConstructor
public class MitigationController {

    private final MitigationEngine mitigationEngine;

    @GetMapping("/status")
    public MitigationStatus status() {
        return mitigationEngine.getStatus();
    }

    @GetMapping("/blocked")
    public List<BlockRecord> blocked() {
        return mitigationEngine.getBlocked();
    }

    @PostMapping("/blocked/{sourceId}")
    public BlockRecord block(@PathVariable String sourceId,
                             @RequestParam(defaultValue = "medium") String severity) {
        Severity s;
        try {
            s = Severity.valueOf(severity.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: " + severity);
        }
        return mitigationEngine.block(sourceId, s);
    }

    @PostMapping("/cleanup")
    public CleanupReport cleanup() {
        return mitigationEngine.cleanup();
    }

    /** Called by traffic generators around a generation run. */
    @PostMapping("/generation-session")
    public ResponseEntity<Void> generationSession(@RequestParam boolean active) {
        mitigationEngine.setGenerationSessionActive(active);
        return ResponseEntity.noContent().build();
    }
}
