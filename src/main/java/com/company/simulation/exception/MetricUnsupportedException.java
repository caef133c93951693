package com.company.simulation.exception;

public class MetricUnsupportedException extends SimulationDataException {
    public MetricUnsupportedException(String metric) {
        super("Unsupported metric: " + metric);
    }

    public MetricUnsupportedException(String metric, String column, String file) {
        super("Metric " + metric + " unavailable: column " + column + " missing in " + file);
    }
}
