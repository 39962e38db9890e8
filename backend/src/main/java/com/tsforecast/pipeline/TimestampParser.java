package com.tsforecast.pipeline;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Lenient-format, strict-value timestamp parsing for submitted date cells. Numbers and booleans
 * are never treated as timestamps.
 */
public final class TimestampParser {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
        withOptionalTime("uuuu-MM-dd"),
        withOptionalTime("uuuu/MM/dd"),
        withOptionalTime("MM/dd/uuuu"),
        withOptionalTime("dd.MM.uuuu")
    );

    private static final List<DateTimeFormatter> YEAR_MONTH_FORMATS = List.of(
        DateTimeFormatter.ofPattern("uuuu-MM").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.ofPattern("uuuu/MM").withResolverStyle(ResolverStyle.STRICT)
    );

    private TimestampParser() {
    }

    public static Optional<LocalDateTime> parse(Object value) {
        if (value instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime);
        }
        if (value instanceof LocalDate date) {
            return Optional.of(date.atStartOfDay());
        }
        if (!(value instanceof String text)) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            Optional<LocalDateTime> parsed = attempt(() -> LocalDateTime.parse(trimmed, format));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        Optional<LocalDateTime> zoned = attempt(() -> OffsetDateTime.parse(trimmed).toLocalDateTime())
            .or(() -> attempt(() -> ZonedDateTime.parse(trimmed).toLocalDateTime()));
        if (zoned.isPresent()) {
            return zoned;
        }
        for (DateTimeFormatter format : YEAR_MONTH_FORMATS) {
            Optional<LocalDateTime> parsed = attempt(() -> YearMonth.parse(trimmed, format).atDay(1).atStartOfDay());
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    public static boolean isTimestamp(Object value) {
        return parse(value).isPresent();
    }

    private static DateTimeFormatter withOptionalTime(String datePattern) {
        return new DateTimeFormatterBuilder()
            .appendPattern(datePattern)
            .optionalStart()
            .appendLiteral('T')
            .optionalEnd()
            .optionalStart()
            .appendLiteral(' ')
            .optionalEnd()
            .optionalStart()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);
    }

    private static Optional<LocalDateTime> attempt(Supplier<LocalDateTime> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
