package com.tsforecast.pipeline;

import java.time.LocalDateTime;
import java.util.Map;

/** A cleaned input row: timestamp, numeric target and any retained passthrough features. */
public record NormalizedPoint(LocalDateTime ds, double y, Map<String, Object> features) {

    public NormalizedPoint {
        features = features == null ? Map.of() : features;
    }
}
