package com.company.simulation.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceCalendarTest {

    @Test
    @DisplayName("Month offsets cover the year without gaps")
    void monthOffsets_coverYear() {
        int hours = 0;
        for (int month = 0; month < ReferenceCalendar.monthCount(); month++) {
            assertThat(ReferenceCalendar.monthStartHour(month)).isEqualTo(hours);
            hours += ReferenceCalendar.daysInMonth(month) * ReferenceCalendar.HOURS_PER_DAY;
        }

        assertThat(ReferenceCalendar.monthCount()).isEqualTo(12);
        assertThat(hours).isEqualTo(ReferenceCalendar.HOURS_PER_YEAR);
        assertThat(ReferenceCalendar.daysInMonth(1)).isEqualTo(28);
        assertThat(ReferenceCalendar.monthEndHour(11)).isEqualTo(8760);
    }

    @Test
    @DisplayName("Timestamps are labelled on the reference year grid")
    void timestamps_sizesAndBounds() {
        List<LocalDateTime> hourly = ReferenceCalendar.hourlyTimestamps(2001);
        List<LocalDateTime> daily = ReferenceCalendar.dailyTimestamps(2001);
        List<LocalDateTime> monthly = ReferenceCalendar.monthlyTimestamps(2001);

        assertThat(hourly).hasSize(8760);
        assertThat(hourly.get(0)).isEqualTo(LocalDateTime.of(2001, 1, 1, 0, 0));
        assertThat(hourly.get(8759)).isEqualTo(LocalDateTime.of(2001, 12, 31, 23, 0));

        assertThat(daily).hasSize(365);
        assertThat(daily.get(59)).isEqualTo(LocalDateTime.of(2001, 3, 1, 0, 0));

        assertThat(monthly).hasSize(12);
        assertThat(monthly.get(1)).isEqualTo(LocalDateTime.of(2001, 2, 1, 0, 0));
    }

    @Test
    @DisplayName("Leap years are rejected as reference years")
    void requireNonLeap_rejectsLeapYear() {
        assertThatThrownBy(() -> ReferenceCalendar.requireNonLeap(2000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2000");
        assertThatThrownBy(() -> ReferenceCalendar.hourlyTimestamps(2024))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
