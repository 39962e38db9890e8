package com.tsforecast.engine;

import com.tsforecast.pipeline.SeriesPoint;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/** Predicts a fixed value with fixed-width bounds for every date; counts fits. */
public class StubEngine implements ForecastEngine {

    private final double value;
    private final double halfWidth;
    private final String secondaryModel;
    private final AtomicInteger fits = new AtomicInteger();

    public StubEngine(double value, double halfWidth) {
        this(value, halfWidth, null);
    }

    public StubEngine(double value, double halfWidth, String secondaryModel) {
        this.value = value;
        this.halfWidth = halfWidth;
        this.secondaryModel = secondaryModel;
    }

    @Override
    public String name() {
        return "Stub";
    }

    @Override
    public FittedModel fit(List<SeriesPoint> history, SeasonalityOptions seasonality) {
        fits.incrementAndGet();
        return new FittedModel() {
            @Override
            public List<ForecastPoint> predict(List<LocalDate> dates) {
                return dates.stream()
                    .map(d -> new ForecastPoint(d, value, value - halfWidth, value + halfWidth))
                    .toList();
            }

            @Override
            public String secondaryModel() {
                return secondaryModel;
            }
        };
    }

    public int fitCount() {
        return fits.get();
    }
}
