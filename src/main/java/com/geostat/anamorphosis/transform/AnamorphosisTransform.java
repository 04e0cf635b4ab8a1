package com.geostat.anamorphosis.transform;

import com.geostat.anamorphosis.hermite.HermiteExpansion;
import com.geostat.anamorphosis.hermite.HermiteMatrix;
import com.geostat.anamorphosis.hermite.HermiteRecurrence;

/**
 * Gaussian to raw ({@code Y2Z}) and raw to Gaussian ({@code Z2Y_linear})
 * conversions of a fitted anamorphosis.
 * <p>
 * Between the practical bounds the forward transform is the Hermite
 * expansion. Beyond them it is the straight line joining the practical anchor
 * to the authorized anchor, clamped at the authorized value. The inverse
 * reads the tabulated empirical curve inside the practical interval and uses
 * the same anchors outside it.
 * <p>
 * Instances are immutable.
 */
public final class AnamorphosisTransform {
    private final double[] pci;
    private final double r;
    private final ControlAnchors anchors;
    private final double[] zTable;
    private final double[] yTable;

    /**
     * @param pci     Hermite coefficients, length K+1 with K >= 1.
     * @param r       support coefficient applied by the forward transform.
     * @param anchors control anchors.
     * @param zTable  raw side of the inverse table, non-decreasing.
     * @param yTable  Gaussian side of the inverse table.
     */
    public AnamorphosisTransform(double[] pci, double r, ControlAnchors anchors, double[] zTable, double[] yTable) {
        if (pci.length < 2)
            throw new IllegalArgumentException("PCI length must be >= 2, got " + pci.length);
        if (zTable.length != yTable.length || zTable.length == 0)
            throw new IllegalArgumentException("Inverse table length mismatch: z length " + zTable.length
                    + ", y length " + yTable.length);
        this.pci = pci.clone();
        this.r = r;
        this.anchors = anchors;
        this.zTable = zTable.clone();
        this.yTable = yTable.clone();
    }

    public ControlAnchors anchors() {
        return anchors;
    }

    public double supportCoefficient() {
        return r;
    }

    /**
     * Gaussian to raw.
     *
     * @param y Gaussian values.
     * @return raw values, one per input.
     */
    public double[] gaussianToRaw(double[] y) {
        if (y.length == 0)
            return new double[0];
        HermiteMatrix h = HermiteRecurrence.generate(y, pci.length - 1);
        double[] z = HermiteExpansion.evaluate(pci, h, r);
        ControlAnchors a = anchors;
        for (int i = 0; i < y.length; i++) {
            if (y[i] <= a.ypmin())
                z[i] = Interpolation.twoPoint(y[i], a.yamin(), a.zamin(), a.ypmin(), a.zpmin());
            if (y[i] >= a.ypmax())
                z[i] = Interpolation.twoPoint(y[i], a.ypmax(), a.zpmax(), a.yamax(), a.zamax());
        }
        return z;
    }

    /** Single-value form of {@link #gaussianToRaw(double[])}. */
    public double gaussianToRaw(double y) {
        return gaussianToRaw(new double[] { y })[0];
    }

    /**
     * Raw to Gaussian. Each value falls into exactly one region, tested in
     * this order: at or below zamin, at or above zamax, at or below zpmin, at
     * or above zpmax, inside the practical interval.
     *
     * @param z raw values.
     * @return Gaussian values, one per input.
     */
    public double[] rawToGaussian(double[] z) {
        ControlAnchors a = anchors;
        double[] y = new double[z.length];
        for (int i = 0; i < z.length; i++) {
            double v = z[i];
            if (v <= a.zamin())
                y[i] = a.yamin();
            else if (v >= a.zamax())
                y[i] = a.yamax();
            else if (v <= a.zpmin())
                y[i] = Interpolation.twoPoint(v, a.zamin(), a.yamin(), a.zpmin(), a.ypmin());
            else if (v >= a.zpmax())
                y[i] = Interpolation.twoPoint(v, a.zpmax(), a.ypmax(), a.zamax(), a.yamax());
            else
                y[i] = Interpolation.table(v, zTable, yTable);
        }
        return y;
    }

    /** Single-value form of {@link #rawToGaussian(double[])}. */
    public double rawToGaussian(double z) {
        return rawToGaussian(new double[] { z })[0];
    }
}
