package com.jasmin.trafficshield.benchmark;

import com.jasmin.trafficshield.models.RequestEvent;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class BenchmarkRequest {
    @NotEmpty
    @Valid
    private List<RequestEvent> events;

    @Min(1)
    @Builder.Default
    private int windowSeconds = 60;

    @Min(1)
    @Builder.Default
    private int threshold = 100;

    // known attackers; enables precision/recall when present
    private Set<String> attackers;

    // strategy names to run, all when empty
    private List<String> strategies;
}
