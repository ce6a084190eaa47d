package com.autobal.model;

/**
 * Composite key identifying one epoch of one source.
 *
 * @param sourceId Object identifier
 * @param epoch    Epoch label
 */
public record EpochKey(String sourceId, String epoch) {}
