package com.jasmin.trafficshield.models;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class RequestEvent {
    @NotBlank
    private String sourceId;
    private String path;
    private String method;

    // Arrival time; filled with the service clock when absent
    private Instant timestamp;
}
