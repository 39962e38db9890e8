package com.tsforecast.pipeline;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.tsforecast.SeriesFixtures.FIRST_MONDAY;
import static com.tsforecast.SeriesFixtures.weeklySeries;
import static org.assertj.core.api.Assertions.*;

class SeriesSanitizerTest {

    private final SeriesSanitizer sanitizer = new SeriesSanitizer();

    @Test
    void sanitize_fillsWeeklyGapsForward() {
        List<SeriesPoint> series = List.of(
            new SeriesPoint(FIRST_MONDAY, 10),
            new SeriesPoint(FIRST_MONDAY.plusWeeks(1), 11),
            new SeriesPoint(FIRST_MONDAY.plusWeeks(4), 12),
            new SeriesPoint(FIRST_MONDAY.plusWeeks(5), 13));

        List<SeriesPoint> clean = sanitizer.sanitize(series);

        assertThat(clean).extracting(SeriesPoint::ds).containsExactly(
            FIRST_MONDAY, FIRST_MONDAY.plusWeeks(1), FIRST_MONDAY.plusWeeks(2),
            FIRST_MONDAY.plusWeeks(3), FIRST_MONDAY.plusWeeks(4), FIRST_MONDAY.plusWeeks(5));
        assertThat(clean).extracting(SeriesPoint::y).containsExactly(10.0, 11.0, 11.0, 11.0, 12.0, 13.0);
    }

    @Test
    void sanitize_fillsMonthlyGaps() {
        List<SeriesPoint> series = List.of(
            new SeriesPoint(LocalDate.of(2024, 1, 1), 5),
            new SeriesPoint(LocalDate.of(2024, 2, 1), 6),
            new SeriesPoint(LocalDate.of(2024, 4, 1), 7),
            new SeriesPoint(LocalDate.of(2024, 5, 1), 8));

        assertThat(sanitizer.sanitize(series)).extracting(SeriesPoint::ds).containsExactly(
            LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1), LocalDate.of(2024, 3, 1),
            LocalDate.of(2024, 4, 1), LocalDate.of(2024, 5, 1));
    }

    @Test
    void sanitize_clampsOutliersToIqrFences() {
        List<SeriesPoint> series = weeklySeries(10, 11, 12, 10, 11, 12, 10, 11, 1000);

        List<SeriesPoint> clean = sanitizer.sanitize(series);

        // Q1 = 10, Q3 = 12, upper fence = 12 + 1.5 * 2
        assertThat(clean).hasSize(series.size());
        assertThat(clean.get(8).y()).isEqualTo(15.0);
        assertThat(clean.subList(0, 8)).extracting(SeriesPoint::y)
            .containsExactly(10.0, 11.0, 12.0, 10.0, 11.0, 12.0, 10.0, 11.0);
    }

    @Test
    void sanitize_singleSpikeIsStableUnderRepeat() {
        List<SeriesPoint> series = weeklySeries(10, 11, 12, 10, 11, 12, 10, 11, 1000, 12);

        List<SeriesPoint> once = sanitizer.sanitize(series);

        assertThat(sanitizer.sanitize(once)).isEqualTo(once);
    }

    @Test
    void sanitize_clampedBlockTightensFencesOnSecondPass() {
        double[] values = new double[32];
        for (int i = 24; i < 32; i++) {
            values[i] = 100.0;
        }

        List<SeriesPoint> once = sanitizer.sanitize(weeklySeries(values));
        List<SeriesPoint> twice = sanitizer.sanitize(once);

        // Q3 = 25 on the first pass, 15.625 on the second
        assertThat(once.get(31).y()).isEqualTo(62.5);
        assertThat(twice.get(31).y()).isEqualTo(39.0625);
        assertThat(twice.get(0).y()).isZero();
    }

    @Test
    void sanitize_keepsBiweeklyGrid() {
        List<SeriesPoint> series = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            series.add(new SeriesPoint(FIRST_MONDAY.plusWeeks(2L * i), 10.0 + i % 3));
        }

        List<SeriesPoint> clean = sanitizer.sanitize(series);

        assertThat(clean).hasSize(20);
        assertThat(clean).extracting(SeriesPoint::ds)
            .containsExactlyElementsOf(series.stream().map(SeriesPoint::ds).toList());
    }

    @Test
    void sanitize_keepsFourWeekGridWithoutMonthlyMerge() {
        List<SeriesPoint> series = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            series.add(new SeriesPoint(FIRST_MONDAY.plusDays(28L * i), 10.0));
        }

        List<SeriesPoint> clean = sanitizer.sanitize(series);

        assertThat(clean).isEqualTo(series);
    }

    @Test
    void sanitize_keepsQuarterlyMonthStarts() {
        List<SeriesPoint> series = List.of(
            new SeriesPoint(LocalDate.of(2023, 1, 1), 4),
            new SeriesPoint(LocalDate.of(2023, 4, 1), 5),
            new SeriesPoint(LocalDate.of(2023, 7, 1), 6),
            new SeriesPoint(LocalDate.of(2023, 10, 1), 7));

        assertThat(sanitizer.sanitize(series)).isEqualTo(series);
    }

    @Test
    void isRegular_requiresThreeEvenlySpacedPoints() {
        assertThat(sanitizer.isRegular(weeklySeries(1, 2, 3))).isTrue();
        assertThat(sanitizer.isRegular(weeklySeries(1, 2))).isFalse();
        assertThat(sanitizer.isRegular(List.of(
            new SeriesPoint(FIRST_MONDAY, 1),
            new SeriesPoint(FIRST_MONDAY.plusWeeks(1), 2),
            new SeriesPoint(FIRST_MONDAY.plusWeeks(3), 3)))).isFalse();
        assertThat(sanitizer.isRegular(List.of(
            new SeriesPoint(LocalDate.of(2024, 1, 15), 1),
            new SeriesPoint(LocalDate.of(2024, 2, 15), 2),
            new SeriesPoint(LocalDate.of(2024, 3, 15), 3)))).isFalse();
    }

    @Test
    void sanitize_shortSeriesIsReturnedUnchanged() {
        List<SeriesPoint> single = weeklySeries(42);

        assertThat(sanitizer.sanitize(single)).isEqualTo(single);
        assertThat(sanitizer.sanitize(List.of())).isEmpty();
    }

    @Test
    void inferPeriod_weeklyAndMonthlySpacing() {
        assertThat(sanitizer.inferPeriod(weeklySeries(1, 2, 3))).isEqualTo(Frequency.WEEKLY);
        assertThat(sanitizer.inferPeriod(List.of(
            new SeriesPoint(LocalDate.of(2024, 1, 1), 1),
            new SeriesPoint(LocalDate.of(2024, 2, 1), 2),
            new SeriesPoint(LocalDate.of(2024, 3, 1), 3)))).isEqualTo(Frequency.MONTHLY);
    }

    @Test
    void inferPeriod_fallsBackToMedianGap() {
        List<SeriesPoint> monthlyWithHole = List.of(
            new SeriesPoint(LocalDate.of(2024, 1, 1), 1),
            new SeriesPoint(LocalDate.of(2024, 2, 1), 2),
            new SeriesPoint(LocalDate.of(2024, 5, 1), 3),
            new SeriesPoint(LocalDate.of(2024, 6, 1), 4));
        List<SeriesPoint> weeklyPair = weeklySeries(1, 2);

        assertThat(sanitizer.inferPeriod(monthlyWithHole)).isEqualTo(Frequency.MONTHLY);
        assertThat(sanitizer.inferPeriod(weeklyPair)).isEqualTo(Frequency.WEEKLY);
    }
}
