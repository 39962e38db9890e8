package com.tsforecast.engine;

import java.time.LocalDate;

/** A predicted value for one period; the bounds are {@code null} when not computed. */
public record ForecastPoint(LocalDate ds, double yhat, Double yhatLower, Double yhatUpper) {

    public ForecastPoint withoutBounds() {
        return new ForecastPoint(ds, yhat, null, null);
    }

    public boolean hasBounds() {
        return yhatLower != null && yhatUpper != null;
    }
}
