package com.company.simulation.exception;

/**
 * Base type for every failure the project data layer reports to its callers.
 */
public abstract class SimulationDataException extends RuntimeException {

    protected SimulationDataException(String message) {
        super(message);
    }

    protected SimulationDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
