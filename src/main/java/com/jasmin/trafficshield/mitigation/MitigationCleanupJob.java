package com.jasmin.trafficshield.mitigation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class MitigationCleanupJob {

    private final MitigationEngine mitigationEngine;

    @Scheduled(fixedDelayString = "${mitigation.cleanup-interval:PT30S}",
            initialDelayString = "${mitigation.cleanup-interval:PT30S}")
    public void run() {
        try {
            mitigationEngine.cleanup();
        } catch (RuntimeException e) {
            log.error("Scheduled mitigation cleanup failed", e);
        }
    }
}
