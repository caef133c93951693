package com.company.simulation.domain.enums;

import com.company.simulation.exception.AggregationUnsupportedException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Aggregation {
    HOURLY("hourly"),
    DAILY("daily"),
    MONTHLY("monthly");

    private final String wireName;

    Aggregation(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Aggregation fromWireName(String aggregation) {
        if (aggregation == null) {
            throw new AggregationUnsupportedException(null);
        }
        String normalized = aggregation.trim().toLowerCase(Locale.ROOT);
        for (Aggregation value : values()) {
            if (value.wireName.equals(normalized)) {
                return value;
            }
        }
        throw new AggregationUnsupportedException(aggregation);
    }
}
