package com.geostat.anamorphosis.api;

/**
 * Extrapolation model beyond the ends of a transformation table.
 */
public enum TailKind {
    /** Clamp to the table end value. */
    NONE,
    /** Linear in cumulative probability up to the clamp bound. */
    LINEAR,
    /** Power law in cumulative probability up to the clamp bound. */
    POWER,
    /** Hyperbolic decay; upper tail only. */
    HYPERBOLIC
}
