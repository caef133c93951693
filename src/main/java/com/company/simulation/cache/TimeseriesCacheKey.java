package com.company.simulation.cache;

import com.company.simulation.domain.enums.Aggregation;
import com.company.simulation.domain.enums.MetricKind;
import lombok.NonNull;
import lombok.Value;

@Value
public class TimeseriesCacheKey implements ProjectScopedKey {
    @NonNull
    String projectId;
    int scenarioId;
    @NonNull
    MetricKind metric;
    @NonNull
    Aggregation aggregation;
}
