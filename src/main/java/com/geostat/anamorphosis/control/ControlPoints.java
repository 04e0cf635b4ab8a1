package com.geostat.anamorphosis.control;

/**
 * Control-point quadruple {@code (i, j, ii, jj)}.
 *
 * @param lowerAuthorized i, lower authorized index into the evaluated curve.
 * @param upperAuthorized j, upper authorized index into the evaluated curve.
 * @param lowerPractical  ii, lower practical index into the raw table.
 * @param upperPractical  jj, upper practical index into the raw table.
 */
public record ControlPoints(int lowerAuthorized, int upperAuthorized, int lowerPractical, int upperPractical) {

    @Override
    public String toString() {
        return "ControlPoints[i=" + lowerAuthorized + ", j=" + upperAuthorized
                + ", ii=" + lowerPractical + ", jj=" + upperPractical + "]";
    }
}
