package com.tsforecast.pipeline;

import com.tsforecast.exception.ColumnNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves which input columns hold the timestamp and the target metric.
 * <p>
 * Aliases are tried in priority order against lower-cased headers, so the first alias in the
 * list wins regardless of where its column sits in the input. The timestamp role additionally
 * falls back to the first column whose every present value parses as a timestamp; the target
 * role has no fallback.
 */
@Slf4j
@Component
public class ColumnDetector {

    public static final List<String> DEFAULT_DATE_ALIASES =
        List.of("tarih", "date", "gun", "day", "zaman", "time");

    public static final List<String> DEFAULT_TARGET_ALIASES =
        List.of("satis", "sales", "miktar", "quantity", "adet", "amount", "value", "satis_miktari");

    private final List<String> dateAliases;
    private final List<String> targetAliases;

    public ColumnDetector() {
        this(DEFAULT_DATE_ALIASES, DEFAULT_TARGET_ALIASES);
    }

    public ColumnDetector(List<String> dateAliases, List<String> targetAliases) {
        this.dateAliases = dateAliases.stream().map(a -> a.toLowerCase(Locale.ROOT)).toList();
        this.targetAliases = targetAliases.stream().map(a -> a.toLowerCase(Locale.ROOT)).toList();
    }

    public DetectedColumns detect(RawTable table) {
        Map<String, String> byLowerName = new LinkedHashMap<>();
        table.columns().forEach(c -> byLowerName.putIfAbsent(c.toLowerCase(Locale.ROOT), c));

        String date = matchAlias(dateAliases, byLowerName)
            .or(() -> firstTimestampColumn(table))
            .orElseThrow(() -> new ColumnNotFoundException("date"));
        String target = matchAlias(targetAliases, byLowerName)
            .orElseThrow(() -> new ColumnNotFoundException("target"));

        log.debug("Detected columns | date={} | target={} | columns={}", date, target, table.columns());
        return new DetectedColumns(date, target);
    }

    private Optional<String> matchAlias(List<String> aliases, Map<String, String> byLowerName) {
        return aliases.stream()
            .filter(byLowerName::containsKey)
            .map(byLowerName::get)
            .findFirst();
    }

    private Optional<String> firstTimestampColumn(RawTable table) {
        return table.columns().stream()
            .filter(column -> isTimestampColumn(table, column))
            .findFirst();
    }

    private boolean isTimestampColumn(RawTable table, String column) {
        boolean sawValue = false;
        for (RawRecord row : table.rows()) {
            Object value = row.get(column);
            if (value == null) {
                continue;
            }
            if (!TimestampParser.isTimestamp(value)) {
                return false;
            }
            sawValue = true;
        }
        return sawValue;
    }
}
