package com.jasmin.trafficshield.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class MitigationVerdict {
    private String sourceId;
    private MitigationAction action;
    private double anomalyScore;
    private boolean blocked;
}
