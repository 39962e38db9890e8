package com.tsforecast.pipeline;

import com.tsforecast.dto.PredictionResult;
import com.tsforecast.engine.ForecastEngine;
import com.tsforecast.engine.ForecastPoint;
import com.tsforecast.exception.InsufficientDataException;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * One configured run of the forecasting pipeline: detect columns, normalize, aggregate,
 * sanitize, check the post-aggregation minimum, forecast, then shape the client payload.
 * Instances are immutable and built per request by {@link PredictionPipelineFactory}.
 */
@Slf4j
@Builder
public class PredictionPipeline {

    private final ColumnDetector columnDetector;
    private final SchemaNormalizer schemaNormalizer;
    private final TimeAggregator timeAggregator;
    private final SeriesSanitizer seriesSanitizer;
    private final ForecastEngine engine;

    private final Frequency predictionFrequency;
    private final String aggregationLevel;
    private final int predictionPeriod;
    private final List<String> featureColumns;
    private final boolean returnConfidence;
    private final int minDataPoints;
    private final boolean nonNegative;

    public PredictionResult run(List<RawRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new InsufficientDataException("The submitted data set is empty.");
        }
        RawTable table = RawTable.of(records);

        DetectedColumns detected = columnDetector.detect(table);
        List<NormalizedPoint> normalized = schemaNormalizer.normalize(table, detected, featureColumns);
        List<SeriesPoint> aggregated = timeAggregator.aggregate(normalized, aggregationLevel);
        List<SeriesPoint> clean = seriesSanitizer.sanitize(aggregated);

        if (clean.size() < minDataPoints) {
            throw new InsufficientDataException(clean.size(), minDataPoints);
        }

        ForecastOutcome outcome = new Forecaster(engine, predictionFrequency, predictionPeriod, returnConfidence)
            .forecast(clean);
        log.info("Pipeline finished | rawRows={} | buckets={} | horizon={} | frequency={}",
                 records.size(), clean.size(), predictionPeriod, predictionFrequency.label());
        return toResult(outcome);
    }

    private PredictionResult toResult(ForecastOutcome outcome) {
        List<PredictionResult.PredictionRow> rows = outcome.forecast().stream()
            .sorted(Comparator.comparing(ForecastPoint::ds))
            .map(this::toRow)
            .toList();

        ForecastOutcome.SeriesSummary series = outcome.series();
        List<String> features = series.featuresUsed() == null || series.featuresUsed().isEmpty()
            ? List.of("trend", "weekly_seasonality", "yearly_seasonality")
            : series.featuresUsed();

        ForecastOutcome.ModelSummary model = outcome.model();
        return PredictionResult.builder()
            .success(true)
            .dataSummary(PredictionResult.DataSummary.builder()
                .inputRows(series.inputRows())
                .dateRange(series.dateRange())
                .featuresUsed(features)
                .build())
            .predictions(rows)
            .modelInfo(PredictionResult.ModelInfo.builder()
                .algorithm(algorithmLabel(model.algorithm(), model.secondaryModel()))
                .accuracyMae(model.metrics().mae())
                .accuracyRmse(model.metrics().rmse())
                .accuracyMape(model.metrics().mape())
                .backtestPoints(model.backtestPoints())
                .build())
            .build();
    }

    private PredictionResult.PredictionRow toRow(ForecastPoint point) {
        double value = point.yhat();
        Double lower = point.yhatLower();
        Double upper = point.yhatUpper();
        if (nonNegative) {
            // each bound is floored on its own
            value = Math.max(0.0, value);
            lower = lower != null ? Math.max(0.0, lower) : null;
            upper = upper != null ? Math.max(0.0, upper) : null;
        }
        PredictionResult.PredictionRow.PredictionRowBuilder row = PredictionResult.PredictionRow.builder()
            .date(point.ds().toString())
            .predictedValue(value);
        if (returnConfidence && point.hasBounds()) {
            row.confidenceLower(lower).confidenceUpper(upper);
        }
        return row.build();
    }

    /**
     * An "Ensemble ..." label is only kept when a secondary model actually contributed;
     * otherwise the primary engine is named on its own.
     */
    String algorithmLabel(String algorithm, String secondaryModel) {
        if (algorithm == null || algorithm.isBlank()) {
            return engine.name();
        }
        boolean claimsEnsemble = algorithm.strip().toLowerCase(Locale.ROOT).startsWith("ensemble");
        if (claimsEnsemble && (secondaryModel == null || secondaryModel.isBlank())) {
            return engine.name();
        }
        return algorithm;
    }
}
