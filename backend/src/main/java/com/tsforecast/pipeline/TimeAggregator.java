package com.tsforecast.pipeline;

import com.tsforecast.exception.InvalidAggregationLevelException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Sums normalized points into anchor-aligned weekly or monthly buckets. */
@Slf4j
@Component
public class TimeAggregator {

    public List<SeriesPoint> aggregate(List<NormalizedPoint> points, String level) {
        Frequency frequency = Frequency.fromLabel(level)
            .orElseThrow(() -> new InvalidAggregationLevelException(level));
        return aggregate(points, frequency);
    }

    public List<SeriesPoint> aggregate(List<NormalizedPoint> points, Frequency frequency) {
        Map<LocalDate, Double> buckets = new TreeMap<>();
        for (NormalizedPoint point : points) {
            buckets.merge(frequency.anchor(point.ds().toLocalDate()), point.y(), Double::sum);
        }
        List<SeriesPoint> series = buckets.entrySet().stream()
            .map(e -> new SeriesPoint(e.getKey(), e.getValue()))
            .toList();
        log.debug("Aggregated {} points into {} {} buckets", points.size(), series.size(), frequency.label());
        return series;
    }
}
