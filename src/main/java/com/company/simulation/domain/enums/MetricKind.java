package com.company.simulation.domain.enums;

import com.company.simulation.exception.MetricUnsupportedException;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Logical metrics served as time series, each bound to exactly one physical
 * column of the hourly scenario file.
 */
public enum MetricKind {
    COOLING_LOAD("coolingLoad", "Q_RoomCooling", "kWh"),
    HEATING_LOAD("heatingLoad", "Q_RoomHeating", "kWh"),
    ELECTRICITY_CONSUMPTION("electricityConsumption", "Load", "kWh"),
    TEMPERATURE("temperature", "T_outside", "°C");

    private final String wireName;
    private final String column;
    private final String unit;

    MetricKind(String wireName, String column, String unit) {
        this.wireName = wireName;
        this.column = column;
        this.unit = unit;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getColumn() {
        return column;
    }

    public String getUnit() {
        return unit;
    }

    public static MetricKind fromWireName(String metric) {
        if (metric != null) {
            for (MetricKind kind : values()) {
                if (kind.wireName.equalsIgnoreCase(metric.trim())) {
                    return kind;
                }
            }
        }
        throw new MetricUnsupportedException(metric);
    }
}
