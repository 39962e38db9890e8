package com.tsforecast.pipeline;

import com.tsforecast.engine.ForecastEngine;
import com.tsforecast.engine.ForecastEngine.FittedModel;
import com.tsforecast.engine.ForecastPoint;
import com.tsforecast.engine.SeasonalityOptions;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fits the engine on a clean series, forecasts the horizon and estimates accuracy with a holdout
 * backtest on the tail of the series.
 */
@Slf4j
public class Forecaster {

    static final int MIN_BACKTEST_POINTS = 2;
    static final int MIN_TRAINING_SURPLUS = 5;

    private final ForecastEngine engine;
    private final Frequency frequency;
    private final int horizon;
    private final boolean returnConfidence;
    private final SeasonalityOptions seasonality = SeasonalityOptions.weeklyAndYearly();

    public Forecaster(ForecastEngine engine, Frequency frequency, int horizon, boolean returnConfidence) {
        if (horizon <= 0) {
            throw new IllegalArgumentException("Forecast horizon must be greater than 0");
        }
        this.engine = engine;
        this.frequency = frequency;
        this.horizon = horizon;
        this.returnConfidence = returnConfidence;
    }

    public ForecastOutcome forecast(List<SeriesPoint> series) {
        FittedModel model = engine.fit(series, seasonality);
        LocalDate lastObserved = series.get(series.size() - 1).ds();
        List<ForecastPoint> forecast = model.predict(futurePeriods(lastObserved, horizon)).stream()
            .map(p -> returnConfidence ? p : p.withoutBounds())
            .sorted(Comparator.comparing(ForecastPoint::ds))
            .toList();

        int validationSize = validationSize(series.size(), horizon);
        BacktestMetrics metrics = backtest(series, validationSize);

        String dateRange = series.get(0).ds() + " to " + lastObserved;
        log.debug("Forecast produced | horizon={} | backtestPoints={} | metrics={}", horizon, validationSize, metrics);
        return new ForecastOutcome(
            forecast,
            new ForecastOutcome.ModelSummary("Ensemble (" + engine.name() + ")", model.secondaryModel(),
                metrics, validationSize),
            new ForecastOutcome.SeriesSummary(series.size(), dateRange, seasonality.componentNames()));
    }

    /** The first {@code count} period starts strictly after {@code lastObserved}. */
    List<LocalDate> futurePeriods(LocalDate lastObserved, int count) {
        List<LocalDate> dates = new ArrayList<>(count);
        LocalDate period = frequency.anchor(lastObserved);
        while (dates.size() < count) {
            period = frequency.next(period);
            if (period.isAfter(lastObserved)) {
                dates.add(period);
            }
        }
        return dates;
    }

    static int validationSize(int seriesLength, int horizon) {
        return Math.min(Math.max(4, horizon), Math.max(MIN_BACKTEST_POINTS, seriesLength / 3));
    }

    private BacktestMetrics backtest(List<SeriesPoint> series, int validationSize) {
        if (validationSize < MIN_BACKTEST_POINTS || series.size() < validationSize + MIN_TRAINING_SURPLUS) {
            return BacktestMetrics.empty();
        }
        int split = series.size() - validationSize;
        List<SeriesPoint> training = series.subList(0, split);
        Map<LocalDate, Double> actual = series.subList(split, series.size()).stream()
            .collect(Collectors.toMap(SeriesPoint::ds, SeriesPoint::y));

        FittedModel holdoutModel = engine.fit(training, seasonality);
        Map<LocalDate, Double> predicted = holdoutModel
            .predict(futurePeriods(training.get(training.size() - 1).ds(), validationSize)).stream()
            .collect(Collectors.toMap(ForecastPoint::ds, ForecastPoint::yhat, (a, b) -> a));

        List<double[]> matched = actual.keySet().stream()
            .filter(predicted::containsKey)
            .sorted()
            .map(d -> new double[] {actual.get(d), predicted.get(d)})
            .toList();
        if (matched.size() < MIN_BACKTEST_POINTS) {
            return BacktestMetrics.empty();
        }
        return metrics(matched);
    }

    static BacktestMetrics metrics(List<double[]> truthAndPrediction) {
        double absErrorSum = 0.0;
        double squaredErrorSum = 0.0;
        double apeSum = 0.0;
        int apeCount = 0;

        for (double[] pair : truthAndPrediction) {
            double actual = pair[0];
            double error = actual - pair[1];
            absErrorSum += Math.abs(error);
            squaredErrorSum += error * error;
            if (actual != 0.0d) {
                apeSum += Math.abs(error / actual);
                apeCount++;
            }
        }

        double n = truthAndPrediction.size();
        Double mape = apeCount > 0 ? (apeSum / apeCount) * 100.0 : null;
        return new BacktestMetrics(absErrorSum / n, Math.sqrt(squaredErrorSum / n), mape);
    }
}
