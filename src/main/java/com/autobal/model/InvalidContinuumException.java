package com.autobal.model;

/**
 * The continuum model has a non-positive or non-finite sample and cannot be used as a divisor.
 */
public class InvalidContinuumException extends InvalidSpectrumException {

    public static final String CODE = "INVALID_CONTINUUM";

    private final int index;
    private final double value;

    public InvalidContinuumException(int index, double value) {
        super("Continuum must be positive and finite, found " + value + " at index " + index);
        this.index = index;
        this.value = value;
    }

    @Override
    public String errorCode() {
        return CODE;
    }

    public int getIndex() {
        return index;
    }

    public double getValue() {
        return value;
    }
}
