package com.tsforecast.pipeline;

/**
 * Holdout accuracy. Any metric may be {@code null} when the backtest could not run;
 * {@code mape} is a percentage.
 */
public record BacktestMetrics(Double mae, Double rmse, Double mape) {

    public static BacktestMetrics empty() {
        return new BacktestMetrics(null, null, null);
    }
}
