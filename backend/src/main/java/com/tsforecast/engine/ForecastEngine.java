package com.tsforecast.engine;

import com.tsforecast.pipeline.SeriesPoint;

import java.time.LocalDate;
import java.util.List;

/**
 * A trend + seasonality model that can be fitted on a regular series and asked for
 * predictions at arbitrary dates. Implementations must be stateless: every {@link #fit} call
 * yields an independent model.
 */
public interface ForecastEngine {

    /** Label reported in {@code model_info.algorithm}. */
    String name();

    FittedModel fit(List<SeriesPoint> history, SeasonalityOptions seasonality);

    interface FittedModel {

        /**
         * Predicts the given dates, in the order given. Bounds are always populated and satisfy
         * {@code yhatLower <= yhat <= yhatUpper}.
         */
        List<ForecastPoint> predict(List<LocalDate> dates);

        /**
         * Name of a secondary model whose output was blended into the predictions, or
         * {@code null} when only the primary model contributed.
         */
        default String secondaryModel() {
            return null;
        }
    }
}
