package com.company.simulation.exception;

public class DataReadFailureException extends SimulationDataException {
    public DataReadFailureException(String message) {
        super(message);
    }

    public DataReadFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
