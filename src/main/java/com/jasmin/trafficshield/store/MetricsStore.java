package com.jasmin.trafficshield.store;

import com.jasmin.trafficshield.models.AnomalyRecord;
import com.jasmin.trafficshield.models.WindowMetrics;

public interface MetricsStore {

    void append(WindowMetrics metrics);

    void append(AnomalyRecord record);
}
