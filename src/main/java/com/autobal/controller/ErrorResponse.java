package com.autobal.controller;

/**
 * Error body returned for rejected requests.
 *
 * @param code    Stable failure code, e.g. {@code SHAPE_MISMATCH}
 * @param message Human-readable detail
 */
public record ErrorResponse(String code, String message) {}
