package com.company.simulation.service;

import com.company.simulation.domain.enums.Aggregation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TimeseriesAggregatorTest {

    private final TimeseriesAggregator aggregator = new TimeseriesAggregator(2001);

    private static double[] hourIndexSeries() {
        return IntStream.range(0, 8760).asDoubleStream().toArray();
    }

    @Test
    @DisplayName("Hourly aggregation returns a copy of the input")
    void hourly_isIdentity() {
        double[] raw = hourIndexSeries();

        double[] result = aggregator.aggregate(raw, Aggregation.HOURLY);

        assertThat(result).containsExactly(raw);
        assertThat(result).isNotSameAs(raw);
    }

    @Test
    @DisplayName("Daily aggregation averages consecutive 24-hour blocks")
    void daily_meansOfDays() {
        // Arrange
        double[] raw = hourIndexSeries();

        // Act
        double[] result = aggregator.aggregate(raw, Aggregation.DAILY);

        // Assert: mean of 24d..24d+23 is 24d + 11.5
        assertThat(result).hasSize(365);
        for (int day = 0; day < 365; day++) {
            assertThat(result[day]).isCloseTo(24.0 * day + 11.5, within(1e-9));
        }
    }

    @Test
    @DisplayName("Monthly aggregation follows calendar month lengths")
    void monthly_calendarMonths() {
        double[] raw = hourIndexSeries();

        double[] result = aggregator.aggregate(raw, Aggregation.MONTHLY);

        assertThat(result).hasSize(12);
        // January: hours 0..743
        assertThat(result[0]).isCloseTo(371.5, within(1e-9));
        // February: hours 744..1415, not 720..1439
        assertThat(result[1]).isCloseTo((744 + 1415) / 2.0, within(1e-9));
        // December: hours 8016..8759
        assertThat(result[11]).isCloseTo((8016 + 8759) / 2.0, within(1e-9));
    }

    @Test
    @DisplayName("Monthly buckets end exactly at the calendar month boundary")
    void monthly_stepAtJanuaryEnd() {
        // 1.0 through January 31st, 0.0 afterwards
        double[] raw = new double[8760];
        for (int i = 0; i < 744; i++) {
            raw[i] = 1.0;
        }

        double[] result = aggregator.aggregate(raw, Aggregation.MONTHLY);

        assertThat(result[0]).isEqualTo(1.0);
        assertThat(result[1]).isEqualTo(0.0);
        for (int month = 2; month < 12; month++) {
            assertThat(result[month]).isEqualTo(0.0);
        }
    }

    @Test
    @DisplayName("Hour-weighted monthly means reproduce the yearly mean")
    void monthly_weightedMeanMatchesYear() {
        double[] raw = new double[8760];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = Math.sin(i / 100.0) * 50 + (i % 24);
        }
        double yearly = 0;
        for (double v : raw) {
            yearly += v;
        }
        yearly /= raw.length;

        double[] monthly = aggregator.aggregate(raw, Aggregation.MONTHLY);
        int[] daysInMonth = {31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};
        double weighted = 0;
        for (int m = 0; m < 12; m++) {
            weighted += monthly[m] * daysInMonth[m] * 24;
        }
        weighted /= 8760;

        assertThat(weighted).isCloseTo(yearly, within(Math.abs(yearly) * 1e-9 + 1e-9));
    }

    @Test
    @DisplayName("Inputs that are not a full year are rejected")
    void aggregate_rejectsWrongLength() {
        assertThatThrownBy(() -> aggregator.aggregate(new double[8759], Aggregation.DAILY))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("8759");
        assertThatThrownBy(() -> aggregator.aggregate(null, Aggregation.HOURLY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Bucket starts match the number of aggregated values")
    void bucketStarts_alignWithBuckets() {
        assertThat(aggregator.bucketStarts(Aggregation.HOURLY)).hasSize(8760);
        assertThat(aggregator.bucketStarts(Aggregation.DAILY)).hasSize(365);
        assertThat(aggregator.bucketStarts(Aggregation.MONTHLY))
                .hasSize(12)
                .startsWith(LocalDateTime.of(2001, 1, 1, 0, 0));
    }

    @Test
    @DisplayName("A leap reference year is refused at construction")
    void constructor_rejectsLeapYear() {
        assertThatThrownBy(() -> new TimeseriesAggregator(2000))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
