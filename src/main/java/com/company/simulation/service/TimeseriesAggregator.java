package com.company.simulation.service;

import com.company.simulation.config.SimulationProperties;
import com.company.simulation.domain.enums.Aggregation;
import com.company.simulation.util.ReferenceCalendar;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Downsamples a year of hourly values into daily or calendar-month means.
 */
@Component
public class TimeseriesAggregator {

    private final int referenceYear;

    @Autowired
    public TimeseriesAggregator(SimulationProperties properties) {
        this(properties.getReferenceYear());
    }

    public TimeseriesAggregator(int referenceYear) {
        ReferenceCalendar.requireNonLeap(referenceYear);
        this.referenceYear = referenceYear;
    }

    public double[] aggregate(double[] raw, Aggregation aggregation) {
        if (raw == null || raw.length != ReferenceCalendar.HOURS_PER_YEAR) {
            throw new IllegalArgumentException("Expected " + ReferenceCalendar.HOURS_PER_YEAR
                    + " hourly values but got " + (raw == null ? "null" : raw.length));
        }

        switch (aggregation) {
            case HOURLY:
                return raw.clone();
            case DAILY:
                return dailyMeans(raw);
            case MONTHLY:
                return monthlyMeans(raw);
            default:
                throw new IllegalArgumentException("Unknown aggregation: " + aggregation);
        }
    }

    /**
     * Start of each bucket produced by {@link #aggregate} on the reference year grid.
     */
    public List<LocalDateTime> bucketStarts(Aggregation aggregation) {
        switch (aggregation) {
            case HOURLY:
                return ReferenceCalendar.hourlyTimestamps(referenceYear);
            case DAILY:
                return ReferenceCalendar.dailyTimestamps(referenceYear);
            case MONTHLY:
                return ReferenceCalendar.monthlyTimestamps(referenceYear);
            default:
                throw new IllegalArgumentException("Unknown aggregation: " + aggregation);
        }
    }

    public int getReferenceYear() {
        return referenceYear;
    }

    private static double[] dailyMeans(double[] raw) {
        double[] means = new double[ReferenceCalendar.DAYS_PER_YEAR];
        for (int day = 0; day < means.length; day++) {
            int start = day * ReferenceCalendar.HOURS_PER_DAY;
            means[day] = mean(raw, start, start + ReferenceCalendar.HOURS_PER_DAY);
        }
        return means;
    }

    private static double[] monthlyMeans(double[] raw) {
        double[] means = new double[ReferenceCalendar.monthCount()];
        for (int month = 0; month < means.length; month++) {
            means[month] = mean(raw, ReferenceCalendar.monthStartHour(month), ReferenceCalendar.monthEndHour(month));
        }
        return means;
    }

    private static double mean(double[] values, int fromInclusive, int toExclusive) {
        double sum = 0.0;
        for (int i = fromInclusive; i < toExclusive; i++) {
            sum += values[i];
        }
        return sum / (toExclusive - fromInclusive);
    }
}
