package com.tsforecast.pipeline;

import com.tsforecast.exception.ColumnNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tsforecast.SeriesFixtures.records;
import static com.tsforecast.SeriesFixtures.row;
import static org.assertj.core.api.Assertions.*;

class ColumnDetectorTest {

    private final ColumnDetector detector = new ColumnDetector();

    @Test
    void detect_matchesAliasesCaseInsensitively() {
        RawTable table = RawTable.of(records(List.of(row("Sales", 10, "DATE", "2024-01-01"))));

        DetectedColumns detected = detector.detect(table);

        assertThat(detected.date()).isEqualTo("DATE");
        assertThat(detected.target()).isEqualTo("Sales");
    }

    @Test
    void detect_prefersAliasPriorityOverColumnOrder() {
        RawTable table = RawTable.of(records(List.of(
            row("day", "2024-01-01", "value", 3, "tarih", "2024-01-02", "quantity", 4))));

        DetectedColumns detected = detector.detect(table);

        assertThat(detected.date()).isEqualTo("tarih");
        assertThat(detected.target()).isEqualTo("quantity");
    }

    @Test
    void detect_fallsBackToFirstParseableDateColumn() {
        RawTable table = RawTable.of(records(List.of(
            row("label", "a", "when", "2024-01-01", "observed", "2024-02-01", "amount", 1),
            row("label", "b", "when", "2024-01-08", "observed", "2024-02-08", "amount", 2))));

        assertThat(detector.detect(table).date()).isEqualTo("when");
    }

    @Test
    void detect_fallbackRejectsColumnsWithAnyUnparseableValue() {
        RawTable table = RawTable.of(records(List.of(
            row("when", "2024-01-01", "other", "2024-01-01", "amount", 1),
            row("when", "soon", "other", "2024-01-08", "amount", 2))));

        assertThat(detector.detect(table).date()).isEqualTo("other");
    }

    @Test
    void detect_numericColumnsAreNotTimestamps() {
        RawTable table = RawTable.of(records(List.of(row("sequence", 1, "amount", 5))));

        assertThatThrownBy(() -> detector.detect(table))
            .isInstanceOf(ColumnNotFoundException.class)
            .hasMessageContaining("date");
    }

    @Test
    void detect_missingTarget_throwsColumnNotFound() {
        RawTable table = RawTable.of(records(List.of(row("date", "2024-01-01", "price", 5))));

        assertThatThrownBy(() -> detector.detect(table))
            .isInstanceOf(ColumnNotFoundException.class)
            .hasMessageContaining("target");
    }

    @Test
    void detect_customAliases() {
        ColumnDetector custom = new ColumnDetector(List.of("Period"), List.of("Revenue"));
        RawTable table = RawTable.of(records(List.of(row("revenue", 1, "period", "2024-01"))));

        assertThat(custom.detect(table)).isEqualTo(new DetectedColumns("period", "revenue"));
    }
}
