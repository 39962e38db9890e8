package com.tsforecast.engine;

import com.tsforecast.pipeline.SeriesPoint;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class AdditiveSeasonalEngineTest {

    private static final LocalDate START = LocalDate.of(2022, 1, 3);

    private final AdditiveSeasonalEngine engine = new AdditiveSeasonalEngine();

    @Test
    void predict_followsLinearTrend() {
        List<SeriesPoint> history = IntStream.range(0, 60)
            .mapToObj(i -> new SeriesPoint(START.plusWeeks(i), 200.0 + 3.0 * i))
            .toList();

        ForecastEngine.FittedModel model = engine.fit(history, SeasonalityOptions.weeklyAndYearly());
        List<ForecastPoint> forecast = model.predict(List.of(START.plusWeeks(60), START.plusWeeks(61)));

        assertThat(forecast.get(0).yhat()).isCloseTo(380.0, within(20.0));
        assertThat(forecast.get(1).yhat()).isGreaterThan(forecast.get(0).yhat() - 5.0);
    }

    @Test
    void predict_boundsEncloseEstimateAndWidenWithDistance() {
        List<SeriesPoint> history = IntStream.range(0, 36)
            .mapToObj(i -> new SeriesPoint(LocalDate.of(2021, 1, 1).plusMonths(i), 50.0 + (i % 5) * 4.0))
            .toList();

        ForecastEngine.FittedModel model = engine.fit(history, SeasonalityOptions.weeklyAndYearly());
        List<ForecastPoint> forecast = model.predict(List.of(LocalDate.of(2024, 1, 1), LocalDate.of(2025, 6, 1)));

        assertThat(forecast).allSatisfy(p -> {
            assertThat(p.hasBounds()).isTrue();
            assertThat(p.yhatLower()).isLessThanOrEqualTo(p.yhat());
            assertThat(p.yhat()).isLessThanOrEqualTo(p.yhatUpper());
        });
        double nearWidth = forecast.get(0).yhatUpper() - forecast.get(0).yhatLower();
        double farWidth = forecast.get(1).yhatUpper() - forecast.get(1).yhatLower();
        assertThat(farWidth).isGreaterThan(nearWidth);
    }

    @Test
    void fit_constantSeriesPredictsTheConstant() {
        List<SeriesPoint> history = IntStream.range(0, 20)
            .mapToObj(i -> new SeriesPoint(START.plusWeeks(i), 0.0))
            .toList();

        ForecastPoint point = engine.fit(history, SeasonalityOptions.weeklyAndYearly())
            .predict(List.of(START.plusWeeks(20))).get(0);

        assertThat(point.yhat()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void fit_rejectsEmptyHistoryAndDailySeasonality() {
        assertThatIllegalArgumentException()
            .isThrownBy(() -> engine.fit(List.of(), SeasonalityOptions.weeklyAndYearly()));
        assertThatIllegalArgumentException()
            .isThrownBy(() -> engine.fit(List.of(new SeriesPoint(START, 1)), new SeasonalityOptions(true, true, true)));
    }

    @Test
    void name_isStable() {
        assertThat(engine.name()).isEqualTo("Additive Seasonal Regression");
    }
}
