package com.tsforecast.pipeline;

import com.tsforecast.engine.ForecastPoint;

import java.util.List;

/** Raw forecaster output, before the pipeline normalizes it for clients. */
public record ForecastOutcome(List<ForecastPoint> forecast, ModelSummary model, SeriesSummary series) {

    /**
     * @param algorithm      label as produced by the forecaster
     * @param secondaryModel model blended in next to the primary engine, {@code null} if none
     * @param backtestPoints size of the held-out validation tail
     */
    public record ModelSummary(String algorithm, String secondaryModel, BacktestMetrics metrics, int backtestPoints) {
    }

    public record SeriesSummary(int inputRows, String dateRange, List<String> featuresUsed) {
    }
}
