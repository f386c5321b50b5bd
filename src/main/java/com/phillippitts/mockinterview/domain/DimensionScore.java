package com.phillippitts.mockinterview.domain;

/**
 * One radar-chart axis in display units.
 *
 * @param label   axis label
 * @param value   score on the 0-100 display scale
 * @param derived {@code true} when heuristically derived from other dimensions rather than measured
 */
public record DimensionScore(String label, int value, boolean derived) {}
