package com.company.simulation.cache;

import lombok.NonNull;
import lombok.Value;

@Value
public class StatsCacheKey implements ProjectScopedKey {
    @NonNull
    String projectId;
}
