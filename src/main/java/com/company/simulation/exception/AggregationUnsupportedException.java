package com.company.simulation.exception;

public class AggregationUnsupportedException extends SimulationDataException {
    public AggregationUnsupportedException(String aggregation) {
        super("Unsupported aggregation: " + aggregation);
    }
}
