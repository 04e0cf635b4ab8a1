package com.geostat.anamorphosis.api;

/**
 * Empirical anamorphosis table: sorted raw values and their paired Gaussian
 * scores, equal length, both non-decreasing.
 */
public final class TransformTable {
    private final double[] raw;
    private final double[] gaussian;

    public TransformTable(double[] raw, double[] gaussian) {
        if (raw.length != gaussian.length)
            throw new IllegalArgumentException("Transform table length mismatch: raw length " + raw.length
                    + ", gaussian length " + gaussian.length);
        this.raw = raw.clone();
        this.gaussian = gaussian.clone();
    }

    /** Copy of the sorted raw values. */
    public double[] raw() {
        return raw.clone();
    }

    /** Copy of the Gaussian scores. */
    public double[] gaussian() {
        return gaussian.clone();
    }

    public double rawAt(int index) {
        return raw[index];
    }

    public double gaussianAt(int index) {
        return gaussian[index];
    }

    public int size() {
        return raw.length;
    }
}
