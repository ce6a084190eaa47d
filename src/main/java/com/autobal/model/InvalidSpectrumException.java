package com.autobal.model;

/**
 * Base type for input that the engine refuses to analyse.
 *
 * <p>Failures are deterministic for a given input; retrying with the same input is pointless.
 */
public abstract class InvalidSpectrumException extends IllegalArgumentException {

    protected InvalidSpectrumException(String message) {
        super(message);
    }

    /** Stable code that lets callers tell the failure kinds apart. */
    public abstract String errorCode();
}
