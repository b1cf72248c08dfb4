package com.retailerp.erp_backend.util;

import com.retailerp.erp_backend.enums.RecurrenceFrequency;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes the dates of the child occurrences of a recurring expense. The start date itself is the
 * parent expense and is never part of the result.
 */
public class RecurrenceCalculator {

    private RecurrenceCalculator() {
        // Utility class, no instantiation
    }

    public static final int MAX_OCCURRENCES = 12;
    public static final int MAX_HORIZON_DAYS = 365;

    public static List<LocalDate> occurrences(LocalDate startDate, RecurrenceFrequency frequency,
                                              Integer dayOfWeek, Integer dayOfMonth, LocalDate endDate) {
        LocalDate horizon = startDate.plusDays(MAX_HORIZON_DAYS);
        LocalDate boundary = endDate != null && endDate.isBefore(horizon) ? endDate : horizon;

        if (frequency == RecurrenceFrequency.WEEKLY) {
            return weekly(startDate, toDayOfWeek(dayOfWeek), boundary);
        }
        return monthly(startDate, dayOfMonth, boundary);
    }

    /**
     * Maps the stored day index (0 = Monday ... 6 = Sunday) to {@link DayOfWeek}.
     */
    public static DayOfWeek toDayOfWeek(int dayIndex) {
        return DayOfWeek.of(dayIndex + 1);
    }

    private static List<LocalDate> weekly(LocalDate startDate, DayOfWeek dayOfWeek, LocalDate boundary) {
        List<LocalDate> dates = new ArrayList<>();
        long daysAhead = dayOfWeek.getValue() - startDate.getDayOfWeek().getValue();
        if (daysAhead <= 0) {
            daysAhead += 7;
        }
        LocalDate next = startDate.plusDays(daysAhead);
        while (!next.isAfter(boundary) && dates.size() < MAX_OCCURRENCES) {
            dates.add(next);
            next = next.plus(1, ChronoUnit.WEEKS);
        }
        return dates;
    }

    private static List<LocalDate> monthly(LocalDate startDate, int dayOfMonth, LocalDate boundary) {
        List<LocalDate> dates = new ArrayList<>();
        for (int i = 1; i <= MAX_OCCURRENCES; i++) {
            LocalDate month = startDate.withDayOfMonth(1).plusMonths(i);
            LocalDate next = month.withDayOfMonth(Math.min(dayOfMonth, month.lengthOfMonth()));
            if (next.isAfter(boundary)) {
                break;
            }
            dates.add(next);
        }
        return dates;
    }
}
