package com.geostat.anamorphosis.transform;

/**
 * Piecewise linear interpolation, clamped to the end ordinates outside the
 * abscissa range.
 */
public final class Interpolation {
    private Interpolation() {
        // Utility class
    }

    /**
     * Interpolates through two anchors. Anchors may be given in either order;
     * equal abscissas return the second ordinate.
     */
    public static double twoPoint(double x, double x0, double y0, double x1, double y1) {
        if (x0 > x1) {
            double t = x0;
            x0 = x1;
            x1 = t;
            t = y0;
            y0 = y1;
            y1 = t;
        } else if (x0 == x1) {
            return y1;
        }
        if (x <= x0)
            return y0;
        if (x >= x1)
            return y1;
        return y0 + (x - x0) * (y1 - y0) / (x1 - x0);
    }

    /**
     * Interpolates in a table with non-decreasing abscissas. Ties in
     * {@code xs} are allowed.
     *
     * @param x  query point.
     * @param xs abscissas, non-decreasing.
     * @param ys ordinates, same length.
     * @return the interpolated value.
     */
    public static double table(double x, double[] xs, double[] ys) {
        int n = xs.length;
        if (x <= xs[0])
            return ys[0];
        if (x >= xs[n - 1])
            return ys[n - 1];

        // First index with xs[hi] > x; xs[hi-1] <= x < xs[hi]
        int lo = 0;
        int hi = n - 1;
        while (lo < hi) {
            int m = (lo + hi) >>> 1;
            if (xs[m] <= x)
                lo = m + 1;
            else
                hi = m;
        }
        int a = hi - 1;
        return ys[a] + (x - xs[a]) * (ys[hi] - ys[a]) / (xs[hi] - xs[a]);
    }
}
