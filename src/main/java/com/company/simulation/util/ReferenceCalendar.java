package com.company.simulation.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;

/**
 * Synthetic non-leap calendar used to put timestamps on hour-of-year indices.
 */
public final class ReferenceCalendar {

    public static final int HOURS_PER_DAY = 24;
    public static final int DAYS_PER_YEAR = 365;
    public static final int HOURS_PER_YEAR = HOURS_PER_DAY * DAYS_PER_YEAR;

    /**
     * Cumulative hour offsets of month starts, January through December, plus the end of the year.
     */
    private static final int[] MONTH_HOUR_OFFSETS =
            {0, 744, 1416, 2160, 2880, 3624, 4344, 5088, 5832, 6552, 7296, 8016, 8760};

    private ReferenceCalendar() {
    }

    public static int monthCount() {
        return MONTH_HOUR_OFFSETS.length - 1;
    }

    public static int monthStartHour(int monthIndex) {
        return MONTH_HOUR_OFFSETS[monthIndex];
    }

    public static int monthEndHour(int monthIndex) {
        return MONTH_HOUR_OFFSETS[monthIndex + 1];
    }

    public static int daysInMonth(int monthIndex) {
        return (monthEndHour(monthIndex) - monthStartHour(monthIndex)) / HOURS_PER_DAY;
    }

    public static void requireNonLeap(int year) {
        if (Year.isLeap(year)) {
            throw new IllegalArgumentException("Reference year must not be a leap year: " + year);
        }
    }

    public static List<LocalDateTime> hourlyTimestamps(int year) {
        requireNonLeap(year);
        LocalDateTime start = LocalDate.of(year, 1, 1).atStartOfDay();
        List<LocalDateTime> timestamps = new ArrayList<>(HOURS_PER_YEAR);
        for (int hour = 0; hour < HOURS_PER_YEAR; hour++) {
            timestamps.add(start.plusHours(hour));
        }
        return List.copyOf(timestamps);
    }

    public static List<LocalDateTime> dailyTimestamps(int year) {
        requireNonLeap(year);
        LocalDate start = LocalDate.of(year, 1, 1);
        List<LocalDateTime> timestamps = new ArrayList<>(DAYS_PER_YEAR);
        for (int day = 0; day < DAYS_PER_YEAR; day++) {
            timestamps.add(start.plusDays(day).atStartOfDay());
        }
        return List.copyOf(timestamps);
    }

    public static List<LocalDateTime> monthlyTimestamps(int year) {
        requireNonLeap(year);
        List<LocalDateTime> timestamps = new ArrayList<>(monthCount());
        for (int month = 1; month <= monthCount(); month++) {
            timestamps.add(LocalDate.of(year, month, 1).atStartOfDay());
        }
        return List.copyOf(timestamps);
    }
}
