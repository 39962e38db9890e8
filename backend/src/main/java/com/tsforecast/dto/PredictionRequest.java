package com.tsforecast.dto;

import com.tsforecast.pipeline.Frequency;
import com.tsforecast.pipeline.RawRecord;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A validated {@code /predict} request. Immutable, so a background job can own it without
 * sharing state with the request thread.
 */
@Value
@Builder
public class PredictionRequest {
    List<RawRecord> data;
    int predictionPeriod;
    Frequency predictionFrequency;
    @Builder.Default
    List<String> featureColumns = List.of();
    boolean confidenceInterval;
    /** Callback address, or {@code null} for a synchronous request. */
    String callbackUrl;

    public boolean isAsync() {
        return callbackUrl != null;
    }
}
