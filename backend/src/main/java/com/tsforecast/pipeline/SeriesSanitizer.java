package com.tsforecast.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Regularizes an aggregated series: reindexes an irregular one onto a complete period grid,
 * fills the holes by carrying values forward (then backward for a leading hole) and clamps
 * every value into {@code [Q1 - 1.5 IQR, Q3 + 1.5 IQR]}. Values are clamped, never removed.
 * <p>
 * Clamping is not idempotent in general: clamped values move the quartiles, so a second pass
 * can tighten the fences again.
 */
@Slf4j
@Component
public class SeriesSanitizer {

    static final double IQR_FACTOR = 1.5;
    static final long MONTHLY_GAP_DAYS = 25;
    static final long WEEKLY_GAP_DAYS = 6;

    public List<SeriesPoint> sanitize(List<SeriesPoint> series) {
        if (series.size() < 2) {
            return List.copyOf(series);
        }
        List<SeriesPoint> regular;
        if (isRegular(series)) {
            regular = series;
            log.debug("Series already on a regular grid | points={}", series.size());
        } else {
            Frequency period = inferPeriod(series);
            regular = fillGaps(series, period);
            log.debug("Reindexed series | period={} | in={} | out={}", period.label(), series.size(), regular.size());
        }
        return clip(regular);
    }

    /**
     * True when at least three points are evenly spaced, either by a constant number of days or
     * by a constant number of months between month starts. Such a series keeps its own grid,
     * including multiples such as two-week or four-week steps.
     */
    boolean isRegular(List<SeriesPoint> series) {
        if (series.size() < 3) {
            return false;
        }
        long dayStep = ChronoUnit.DAYS.between(series.get(0).ds(), series.get(1).ds());
        long monthStep = ChronoUnit.MONTHS.between(series.get(0).ds(), series.get(1).ds());
        boolean sameDays = dayStep > 0;
        boolean sameMonths = monthStep > 0 && Frequency.MONTHLY.isAnchored(series.get(0).ds());
        for (int i = 1; i < series.size(); i++) {
            LocalDate previous = series.get(i - 1).ds();
            LocalDate current = series.get(i).ds();
            sameDays &= ChronoUnit.DAYS.between(previous, current) == dayStep;
            sameMonths &= current.equals(previous.plusMonths(monthStep));
        }
        return sameDays || sameMonths;
    }

    /** Grid used to reindex an irregular series, chosen from the median gap between points. */
    Frequency inferPeriod(List<SeriesPoint> series) {
        double[] gaps = new double[series.size() - 1];
        for (int i = 1; i < series.size(); i++) {
            gaps[i - 1] = ChronoUnit.DAYS.between(series.get(i - 1).ds(), series.get(i).ds());
        }
        long medianDays = (long) Math.floor(new Median().evaluate(gaps));
        if (medianDays >= MONTHLY_GAP_DAYS) {
            return Frequency.MONTHLY;
        }
        if (medianDays >= WEEKLY_GAP_DAYS) {
            return Frequency.WEEKLY;
        }
        // no sub-weekly period is supported
        return Frequency.WEEKLY;
    }

    private List<SeriesPoint> fillGaps(List<SeriesPoint> series, Frequency period) {
        Map<LocalDate, Double> byPeriod = new TreeMap<>();
        series.forEach(p -> byPeriod.merge(period.anchor(p.ds()), p.y(), Double::sum));

        LocalDate first = period.anchor(series.get(0).ds());
        LocalDate last = series.get(series.size() - 1).ds();
        List<LocalDate> grid = new ArrayList<>();
        for (LocalDate d = first; !d.isAfter(last); d = period.next(d)) {
            grid.add(d);
        }

        Double[] values = new Double[grid.size()];
        Double carried = null;
        for (int i = 0; i < grid.size(); i++) {
            Double observed = byPeriod.get(grid.get(i));
            carried = observed != null ? observed : carried;
            values[i] = carried;
        }
        Double firstKnown = null;
        for (int i = values.length - 1; i >= 0; i--) {
            firstKnown = values[i] != null ? values[i] : firstKnown;
            if (values[i] == null) {
                values[i] = firstKnown;
            }
        }

        List<SeriesPoint> filled = new ArrayList<>(grid.size());
        for (int i = 0; i < grid.size(); i++) {
            filled.add(new SeriesPoint(grid.get(i), values[i]));
        }
        return filled;
    }

    private List<SeriesPoint> clip(List<SeriesPoint> series) {
        double[] values = series.stream().mapToDouble(SeriesPoint::y).toArray();
        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        percentile.setData(values);
        double q1 = percentile.evaluate(25.0);
        double q3 = percentile.evaluate(75.0);
        double iqr = q3 - q1;
        double lower = q1 - IQR_FACTOR * iqr;
        double upper = q3 + IQR_FACTOR * iqr;
        return series.stream()
            .map(p -> p.withY(Math.min(upper, Math.max(lower, p.y()))))
            .toList();
    }
}
