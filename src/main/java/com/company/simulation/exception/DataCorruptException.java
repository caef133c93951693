package com.company.simulation.exception;

/**
 * Stored data does not have the shape the layer relies on: a missing table or
 * required column, a wrong row count, a non-numeric or null value.
 */
public class DataCorruptException extends SimulationDataException {
    public DataCorruptException(String message) {
        super(message);
    }

    public DataCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
