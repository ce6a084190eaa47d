package com.autobal.model;

/**
 * Curves of unequal length, or a grid too short or irregular for the smoothing window.
 */
public class SpectrumShapeException extends InvalidSpectrumException {

    public static final String CODE = "SHAPE_MISMATCH";

    public SpectrumShapeException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return CODE;
    }
}
