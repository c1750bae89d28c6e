package com.energy.anomaly.engine;

/**
 * Base class for caller misuse of the detection engine. None of these are transient, so
 * callers should not retry them.
 */
public class DetectionException extends RuntimeException {

    public DetectionException(String message) {
        super(message);
    }
}
