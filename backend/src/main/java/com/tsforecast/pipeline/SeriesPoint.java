package com.tsforecast.pipeline;

import java.time.LocalDate;

/** One period of a regular series, keyed by the period start. */
public record SeriesPoint(LocalDate ds, double y) {

    public SeriesPoint withY(double value) {
        return new SeriesPoint(ds, value);
    }
}
