package com.tsforecast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/** Body of a successful forecast, returned inline or posted to the callback address. */
@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PredictionResult {
    boolean success;
    DataSummary dataSummary;
    List<PredictionRow> predictions;
    ModelInfo modelInfo;

    @Value
    @Builder
    @Jacksonized
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class DataSummary {
        int inputRows;
        String dateRange;
        List<String> featuresUsed;
    }

    @Value
    @Builder
    @Jacksonized
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class PredictionRow {
        String date;
        double predictedValue;
        Double confidenceLower;
        Double confidenceUpper;
    }

    @Value
    @Builder
    @Jacksonized
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ModelInfo {
        String algorithm;
        Double accuracyMae;
        Double accuracyRmse;
        Double accuracyMape;
        int backtestPoints;
    }
}
