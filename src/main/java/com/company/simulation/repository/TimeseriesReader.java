package com.company.simulation.repository;

import com.company.simulation.domain.ScenarioFile;
import com.company.simulation.domain.enums.MetricKind;

/**
 * Source of raw hourly values for one scenario.
 */
public interface TimeseriesReader {

    /**
     * Reads the physical column mapped to {@code metric}.
     *
     * @return exactly {@link com.company.simulation.util.ReferenceCalendar#HOURS_PER_YEAR} values,
     * index 0 being the first hour of the reference year
     * @throws com.company.simulation.exception.MetricUnsupportedException if the file lacks the column
     * @throws com.company.simulation.exception.DataCorruptException       on a wrong row count or a null value
     * @throws com.company.simulation.exception.DataReadFailureException   if the file cannot be read
     */
    double[] readRaw(ScenarioFile scenarioFile, MetricKind metric);
}
