package com.tsforecast.pipeline;

import com.tsforecast.config.ForecastProperties;
import com.tsforecast.dto.PredictionRequest;
import com.tsforecast.engine.ForecastEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Builds a {@link PredictionPipeline} for one request from its parameters and the startup configuration. */
@Component
@RequiredArgsConstructor
public class PredictionPipelineFactory {

    private final ColumnDetector columnDetector;
    private final SchemaNormalizer schemaNormalizer;
    private final TimeAggregator timeAggregator;
    private final SeriesSanitizer seriesSanitizer;
    private final ForecastEngine engine;
    private final ForecastProperties properties;

    public PredictionPipeline create(PredictionRequest request) {
        return PredictionPipeline.builder()
            .columnDetector(columnDetector)
            .schemaNormalizer(schemaNormalizer)
            .timeAggregator(timeAggregator)
            .seriesSanitizer(seriesSanitizer)
            .engine(engine)
            .predictionFrequency(request.getPredictionFrequency())
            // history is always aggregated at the requested forecast frequency
            .aggregationLevel(request.getPredictionFrequency().label())
            .predictionPeriod(request.getPredictionPeriod())
            .featureColumns(request.getFeatureColumns())
            .returnConfidence(request.isConfidenceInterval())
            .minDataPoints(properties.minDataPoints())
            .nonNegative(properties.nonNegativePredictions())
            .build();
    }
}
