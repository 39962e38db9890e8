package com.tsforecast.pipeline;

import com.tsforecast.exception.ColumnNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps raw rows onto {@code ds}/{@code y} points. Rows with an unparseable timestamp or a
 * non-numeric target are dropped; repeated timestamps are kept for the aggregator to sum.
 */
@Slf4j
@Component
public class SchemaNormalizer {

    public List<NormalizedPoint> normalize(RawTable table, DetectedColumns columns, List<String> featureColumns) {
        List<String> kept = featureColumns == null ? List.of() : featureColumns.stream()
            .filter(table.columns()::contains)
            .filter(f -> !f.equals(columns.date()) && !f.equals(columns.target()))
            .distinct()
            .toList();

        List<NormalizedPoint> points = new ArrayList<>(table.size());
        int dropped = 0;
        for (RawRecord row : table.rows()) {
            Optional<LocalDateTime> ds = TimestampParser.parse(row.get(columns.date()));
            Optional<Double> y = toNumber(row.get(columns.target()));
            if (ds.isEmpty() || y.isEmpty()) {
                dropped++;
                continue;
            }
            Map<String, Object> features = new LinkedHashMap<>();
            kept.forEach(f -> features.put(f, row.get(f)));
            points.add(new NormalizedPoint(ds.get(), y.get(), features));
        }

        if (points.isEmpty()) {
            throw new ColumnNotFoundException("target", columns.target());
        }
        points.sort(Comparator.comparing(NormalizedPoint::ds));
        log.debug("Normalized schema | kept={} | dropped={} | features={}", points.size(), dropped, kept);
        return points;
    }

    static Optional<Double> toNumber(Object value) {
        double number;
        if (value instanceof Double d) {
            number = d;
        } else if (value instanceof Number n) {
            number = n.doubleValue();
        } else if (value instanceof String s && !s.isBlank()) {
            try {
                number = Double.parseDouble(s.trim());
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return Double.isFinite(number) ? Optional.of(number) : Optional.empty();
    }
}
