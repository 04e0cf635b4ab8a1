package com.geostat.anamorphosis;

import com.geostat.anamorphosis.control.ControlPoints;
import com.geostat.anamorphosis.hermite.HermiteExpansion;
import com.geostat.anamorphosis.transform.AnamorphosisTransform;
import com.geostat.anamorphosis.transform.ControlAnchors;

/**
 * Block support anamorphosis derived from a point model through the support
 * coefficient {@code r}. Immutable.
 */
public final class BlockAnamorphosisModel {
    private final double r;
    private final double[] blockPci;
    private final double[] gauss;
    private final double[] curve;
    private final ControlPoints controlPoints;
    private final AnamorphosisTransform transform;

    BlockAnamorphosisModel(double r, double[] blockPci, double[] gauss, double[] curve,
            ControlPoints controlPoints, AnamorphosisTransform transform) {
        this.r = r;
        this.blockPci = blockPci;
        this.gauss = gauss;
        this.curve = curve;
        this.controlPoints = controlPoints;
        this.transform = transform;
    }

    /** Support effect coefficient. */
    public double supportCoefficient() {
        return r;
    }

    /** Copy of {@code PCI[p] * r^p}. */
    public double[] blockPci() {
        return blockPci.clone();
    }

    /** Block variance carried by the expansion. */
    public double variance() {
        return HermiteExpansion.variance(blockPci);
    }

    /** Copy of the regular Gaussian grid the block curve was evaluated on. */
    public double[] gauss() {
        return gauss.clone();
    }

    public double[] curve() {
        return curve.clone();
    }

    public ControlPoints controlPoints() {
        return controlPoints;
    }

    public ControlAnchors anchors() {
        return transform.anchors();
    }

    public double[] gaussianToRaw(double[] y) {
        return transform.gaussianToRaw(y);
    }

    public double[] rawToGaussian(double[] z) {
        return transform.rawToGaussian(z);
    }
}
