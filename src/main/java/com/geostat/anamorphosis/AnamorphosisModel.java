package com.geostat.anamorphosis;

import com.geostat.anamorphosis.api.TransformTable;
import com.geostat.anamorphosis.control.ControlPoints;
import com.geostat.anamorphosis.hermite.HermiteMatrix;
import com.geostat.anamorphosis.hermite.PciFit;
import com.geostat.anamorphosis.transform.AnamorphosisTransform;
import com.geostat.anamorphosis.transform.ControlAnchors;

/**
 * A calibrated point support anamorphosis. Immutable.
 */
public final class AnamorphosisModel {
    private final TransformTable table;
    private final HermiteMatrix hermite;
    private final PciFit fit;
    private final double[] curve;
    private final ControlPoints controlPoints;
    private final AnamorphosisTransform transform;
    private final double rawVariance;

    AnamorphosisModel(TransformTable table, HermiteMatrix hermite, PciFit fit, double[] curve,
            ControlPoints controlPoints, AnamorphosisTransform transform, double rawVariance) {
        this.table = table;
        this.hermite = hermite;
        this.fit = fit;
        this.curve = curve;
        this.controlPoints = controlPoints;
        this.transform = transform;
        this.rawVariance = rawVariance;
    }

    public TransformTable table() {
        return table;
    }

    public HermiteMatrix hermite() {
        return hermite;
    }

    /** Copy of the Hermite coefficients. */
    public double[] pci() {
        return fit.pci();
    }

    public int order() {
        return fit.order();
    }

    /** Copy of the expansion evaluated on the table's Gaussian scores. */
    public double[] curve() {
        return curve.clone();
    }

    public ControlPoints controlPoints() {
        return controlPoints;
    }

    public ControlAnchors anchors() {
        return transform.anchors();
    }

    /** Declustered variance of the raw data. */
    public double rawVariance() {
        return rawVariance;
    }

    /** Variance carried by the expansion. */
    public double pciVariance() {
        return fit.variance();
    }

    public double[] gaussianToRaw(double[] y) {
        return transform.gaussianToRaw(y);
    }

    public double[] rawToGaussian(double[] z) {
        return transform.rawToGaussian(z);
    }
}
