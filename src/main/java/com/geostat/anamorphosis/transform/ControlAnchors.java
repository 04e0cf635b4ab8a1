package com.geostat.anamorphosis.transform;

import com.geostat.anamorphosis.control.ControlPoints;

/**
 * Raw and Gaussian values of the four control points.
 *
 * The authorized pair {@code (za*, ya*)} is read on the analytic curve, the
 * practical pair {@code (zp*, yp*)} on the empirical one.
 */
public record ControlAnchors(double zamin, double yamin,
        double zpmin, double ypmin,
        double zpmax, double ypmax,
        double zamax, double yamax) {

    /**
     * Reads the anchors off the curves at the given control points.
     *
     * @param cp        control points.
     * @param analytic  evaluated expansion, indexed by {@code i}, {@code j}.
     * @param empirical empirical raw curve, indexed by {@code ii}, {@code jj}.
     *                  Block models pass their own curve here.
     * @param gauss     Gaussian grid shared by both curves.
     */
    public static ControlAnchors of(ControlPoints cp, double[] analytic, double[] empirical, double[] gauss) {
        int i = cp.lowerAuthorized();
        int j = cp.upperAuthorized();
        int ii = cp.lowerPractical();
        int jj = cp.upperPractical();
        return new ControlAnchors(
                analytic[i], gauss[i],
                empirical[ii], gauss[ii],
                empirical[jj], gauss[jj],
                analytic[j], gauss[j]);
    }
}
