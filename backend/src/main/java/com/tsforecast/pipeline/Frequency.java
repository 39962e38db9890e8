package com.tsforecast.pipeline;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported series periods and their anchor rules. Aggregation, gap filling and future period
 * generation all go through {@link #anchor(LocalDate)} and {@link #next(LocalDate)} so that
 * forecast dates always land on the historical grid.
 */
public enum Frequency {

    /** Weeks start on Monday. */
    WEEKLY("weekly") {
        @Override
        public LocalDate anchor(LocalDate date) {
            return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        }

        @Override
        public LocalDate next(LocalDate periodStart) {
            return periodStart.plusWeeks(1);
        }
    },

    /** Months start on the first day of the month. */
    MONTHLY("monthly") {
        @Override
        public LocalDate anchor(LocalDate date) {
            return date.withDayOfMonth(1);
        }

        @Override
        public LocalDate next(LocalDate periodStart) {
            return periodStart.plusMonths(1);
        }
    };

    private final String label;

    Frequency(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Start of the period containing {@code date}. */
    public abstract LocalDate anchor(LocalDate date);

    /** Start of the period following the one starting at {@code periodStart}. */
    public abstract LocalDate next(LocalDate periodStart);

    public boolean isAnchored(LocalDate date) {
        return anchor(date).equals(date);
    }

    public static Optional<Frequency> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(f -> f.label.equals(normalized)).findFirst();
    }
}
