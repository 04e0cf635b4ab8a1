package com.geostat.anamorphosis.api;

/**
 * Tail extrapolation settings for a back transform.
 *
 * @param lowerKind      lower tail model.
 * @param lowerParameter shape parameter of the lower tail (power exponent).
 * @param upperKind      upper tail model.
 * @param upperParameter shape parameter of the upper tail (power exponent or
 *                       hyperbolic decay).
 * @param zmin           lower clamp bound.
 * @param zmax           upper clamp bound.
 */
public record TailModel(TailKind lowerKind, double lowerParameter,
        TailKind upperKind, double upperParameter,
        double zmin, double zmax) {

    public TailModel {
        if (lowerKind == null || upperKind == null)
            throw new IllegalArgumentException("Tail kinds must not be null");
        if (!(zmin <= zmax))
            throw new IllegalArgumentException("Expected zmin <= zmax, got zmin=" + zmin + ", zmax=" + zmax);
    }

    /** No extrapolation on either side. */
    public static TailModel none(double zmin, double zmax) {
        return new TailModel(TailKind.NONE, 1.0, TailKind.NONE, 1.0, zmin, zmax);
    }

    /** Linear extrapolation on both sides. */
    public static TailModel linear(double zmin, double zmax) {
        return new TailModel(TailKind.LINEAR, 1.0, TailKind.LINEAR, 1.0, zmin, zmax);
    }
}
