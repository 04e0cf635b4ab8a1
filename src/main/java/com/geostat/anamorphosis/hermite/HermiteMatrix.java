package com.geostat.anamorphosis.hermite;

/**
 * Immutable {@code (K+1) x N} table of normalized Hermite polynomial values.
 *
 * Row {@code k} holds the degree-{@code k} polynomial evaluated at every
 * abscissa of the Gaussian grid the matrix was generated from. Row 0 is
 * identically 1.
 *
 * The backing storage is never handed out. Callers read single cells through
 * {@link #valueAt(int, int)} or take a copy of a row with {@link #row(int)}.
 */
public final class HermiteMatrix {
    private final double[][] values;

    // Takes ownership of the array; only HermiteRecurrence builds these.
    HermiteMatrix(double[][] values) {
        this.values = values;
    }

    /** Truncation order K; the matrix has K+1 rows. */
    public int order() {
        return values.length - 1;
    }

    /** Number of Gaussian abscissas (columns). */
    public int size() {
        return values[0].length;
    }

    /**
     * Returns H[k, i].
     *
     * @param k polynomial degree, 0..K
     * @param i abscissa index, 0..N-1
     * @return the normalized Hermite value.
     * @throws IndexOutOfBoundsException if either index is out of range.
     */
    public double valueAt(int k, int i) {
        return values[k][i];
    }

    /** Returns a copy of row {@code k}. */
    public double[] row(int k) {
        return values[k].clone();
    }
}
