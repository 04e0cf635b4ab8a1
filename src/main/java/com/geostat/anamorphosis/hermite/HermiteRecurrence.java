package com.geostat.anamorphosis.hermite;

/**
 * Normalized (probabilist's) Hermite polynomials by three-term recurrence.
 *
 * <pre>
 * H0(y)   = 1
 * H1(y)   = -y
 * Hk+1(y) = -(1/sqrt(k+1)) * y * Hk(y) - sqrt(k/(k+1)) * Hk-1(y)
 * </pre>
 *
 * Stable for truncation orders in the tens. Cancellation grows with the order
 * and nothing is done about it.
 */
public final class HermiteRecurrence {
    private HermiteRecurrence() {
        // Utility class
    }

    /**
     * Evaluates H0..HK at every entry of {@code y}.
     *
     * @param y Gaussian abscissas, at least one.
     * @param order truncation order K, at least 1.
     * @return the {@code (K+1) x N} matrix.
     */
    public static HermiteMatrix generate(double[] y, int order) {
        if (order < 1)
            throw new IllegalArgumentException("Truncation order must be >= 1, got " + order);
        if (y == null || y.length == 0)
            throw new IllegalArgumentException("Gaussian grid must have length >= 1");

        int n = y.length;
        double[][] h = new double[order + 1][n];
        for (int i = 0; i < n; i++) {
            h[0][i] = 1.0;
            h[1][i] = -y[i];
        }
        for (int k = 1; k < order; k++) {
            double a = 1.0 / Math.sqrt(k + 1.0);
            double b = Math.sqrt(k / (k + 1.0));
            double[] next = h[k + 1];
            double[] cur = h[k];
            double[] prev = h[k - 1];
            for (int i = 0; i < n; i++) {
                next[i] = -a * y[i] * cur[i] - b * prev[i];
            }
        }
        return new HermiteMatrix(h);
    }
}
