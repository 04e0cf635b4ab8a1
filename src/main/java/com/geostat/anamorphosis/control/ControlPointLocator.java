package com.geostat.anamorphosis.control;

import com.geostat.anamorphosis.exceptions.ControlPointException;

import org.apache.commons.math3.stat.StatUtils;

import lombok.extern.log4j.Log4j2;

/**
 * Locates the authorized and practical intervals on an evaluated anamorphosis.
 * <p>
 * Three modes, all returning {@code (i, j, ii, jj)}:
 * <ul>
 * <li>{@link #authorized}: practical indices from the raw table, authorized
 * indices from a midpoint-outward scan of the analytic curve that stops where
 * the curve leaves the practical range, stops increasing, or passes the
 * Gaussian value of the practical index.</li>
 * <li>{@link #authorizedBlock}: block curves are trusted end to end; only the
 * authorized indices are searched, against scalar thresholds.</li>
 * <li>{@link #explicit}: caller-chosen bounds, checked for consistency
 * afterwards.</li>
 * </ul>
 * Comparisons are exact, so results depend on the grid resolution.
 */
@Log4j2
public final class ControlPointLocator {
    private ControlPointLocator() {
        // Utility class
    }

    /** {@link #authorized(double[], double[], double[], Double, Double)} with the practical bounds at min/max of {@code zraw}. */
    public static ControlPoints authorized(double[] zana, double[] zraw, double[] gauss) {
        return authorized(zana, zraw, gauss, null, null);
    }

    /**
     * Data-anchored search.
     *
     * @param zana  analytic curve evaluated on {@code gauss}.
     * @param zraw  empirical raw curve paired with {@code gauss}.
     * @param gauss Gaussian grid, increasing.
     * @param zpmin practical minimum, or {@code null} for {@code min(zraw)}.
     * @param zpmax practical maximum, or {@code null} for {@code max(zraw)}.
     * @return the control points.
     */
    public static ControlPoints authorized(double[] zana, double[] zraw, double[] gauss, Double zpmin, Double zpmax) {
        int n = checkShapes(zana, zraw, gauss);
        double pmin = zpmin != null ? zpmin : StatUtils.min(zraw);
        double pmax = zpmax != null ? zpmax : StatUtils.max(zraw);

        int jj = IndexScan.descending(n - 1, 1, k -> zraw[k] < pmax);
        int ii = IndexScan.ascending(0, n - 2, k -> zraw[k] > pmin);

        int mid = n / 2;
        int j = IndexScan.ascending(mid, n - 2,
                k -> zana[k] >= zraw[jj] || zana[k + 1] <= zana[k] || gauss[k] >= gauss[jj]);
        int i = IndexScan.descending(mid, 1,
                k -> zana[k] <= zraw[ii] || zana[k - 1] >= zana[k] || gauss[k] <= gauss[ii]);

        ControlPoints cp = new ControlPoints(i, j, ii, jj);
        log.debug("Authorized search on {} points, practical [{}, {}]: {}", n, pmin, pmax, cp);
        return cp;
    }

    /**
     * Block support search. Practical indices cover the whole curve.
     *
     * @param zana  block curve, one value per Gaussian grid point.
     * @param zpmin lower threshold.
     * @param zpmax upper threshold.
     * @return the control points, with {@code ii = 0} and {@code jj = N-1}.
     */
    public static ControlPoints authorizedBlock(double[] zana, double zpmin, double zpmax) {
        int n = zana.length;
        if (n < 3)
            throw new IllegalArgumentException("Curve length must be >= 3, got " + n);

        int mid = n / 2;
        int j = IndexScan.ascending(mid, n - 2, k -> zana[k] >= zpmax || zana[k + 1] <= zana[k]);
        int i = IndexScan.descending(mid, 1, k -> zana[k] <= zpmin || zana[k - 1] >= zana[k]);

        ControlPoints cp = new ControlPoints(i, j, 0, n - 1);
        log.debug("Block authorized search on {} points, thresholds [{}, {}]: {}", n, zpmin, zpmax, cp);
        return cp;
    }

    /**
     * Explicit bounds.
     * <p>
     * The authorized pair is taken as given: {@code zamax} must lie below
     * {@code zamin}, with {@code zamin >= zpmin} and {@code zamax <= zpmax}.
     * The lower authorized index is the first index below the midpoint whose
     * curve value is at or under {@code zamin}; the upper one is the first
     * index above the midpoint at or over {@code zamax}.
     *
     * @throws IllegalArgumentException if the bounds are misordered.
     * @throws ControlPointException    if the fitted curve crosses the empirical
     *                                  curve at the located indices.
     */
    public static ControlPoints explicit(double[] zana, double[] zraw, double[] gauss,
            double zpmin, double zpmax, double zamin, double zamax) {
        int n = checkShapes(zana, zraw, gauss);
        if (!(zamax < zamin))
            throw new IllegalArgumentException("Expected zamax < zamin, got zamax=" + zamax + ", zamin=" + zamin);
        if (!(zamin >= zpmin))
            throw new IllegalArgumentException("Expected zamin >= zpmin, got zamin=" + zamin + ", zpmin=" + zpmin);
        if (!(zamax <= zpmax))
            throw new IllegalArgumentException("Expected zamax <= zpmax, got zamax=" + zamax + ", zpmax=" + zpmax);

        int ii = IndexScan.ascending(0, n - 1, k -> zraw[k] >= zpmin);
        int jj = IndexScan.descending(n - 1, 0, k -> zraw[k] <= zpmax);

        int mid = n / 2;
        int i = IndexScan.descending(mid, 0, k -> zana[k] <= zamin);
        int j = IndexScan.ascending(mid, n - 1, k -> zana[k] >= zamax);

        if (zana[j] > zraw[jj])
            throw new ControlPointException("zana[" + j + "]=" + zana[j] + " above zraw[" + jj + "]=" + zraw[jj]);
        if (zana[i] < zraw[ii])
            throw new ControlPointException("zana[" + i + "]=" + zana[i] + " below zraw[" + ii + "]=" + zraw[ii]);
        if (gauss[j] > gauss[jj])
            throw new ControlPointException("gauss[" + j + "]=" + gauss[j] + " above gauss[" + jj + "]=" + gauss[jj]);
        if (gauss[i] < gauss[ii])
            throw new ControlPointException("gauss[" + i + "]=" + gauss[i] + " below gauss[" + ii + "]=" + gauss[ii]);

        ControlPoints cp = new ControlPoints(i, j, ii, jj);
        log.debug("Explicit control points on {} points: {}", n, cp);
        return cp;
    }

    private static int checkShapes(double[] zana, double[] zraw, double[] gauss) {
        int n = zana.length;
        if (zraw.length != n || gauss.length != n)
            throw new IllegalArgumentException("Shape mismatch: zana length " + n + ", zraw length " + zraw.length
                    + ", gauss length " + gauss.length);
        if (n < 3)
            throw new IllegalArgumentException("Curve length must be >= 3, got " + n);
        return n;
    }
}
