package com.company.simulation.domain;

import com.company.simulation.domain.enums.Aggregation;
import com.company.simulation.domain.enums.MetricKind;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

@Value
@Builder
public class TimeseriesResult {
    int scenarioId;
    MetricKind metric;
    Aggregation aggregation;
    String unit;
    List<LocalDateTime> timestamps;
    List<Double> values;

    public int size() {
        return values.size();
    }
}
