package com.company.simulation.exception;

import java.time.Duration;

public class RequestTimeoutException extends SimulationDataException {
    public RequestTimeoutException(Object key, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + " ms waiting for " + key);
    }

    public RequestTimeoutException(Object key, Throwable cause) {
        super("Interrupted while waiting for " + key, cause);
    }
}
