package com.geostat.anamorphosis.hermite;

import java.util.Arrays;

/**
 * Evaluates a truncated Hermite series.
 * <p>
 * Formula: {@code Z = PCI[0] + sum_{p=1}^{K} PCI[p] * r^p * H[p, :]}
 * <p>
 * {@code r = 1} is point support. A block support coefficient {@code r < 1}
 * shrinks every order geometrically; {@code r = 0} collapses the series to
 * PCI[0].
 */
public final class HermiteExpansion {
    private HermiteExpansion() {
        // Utility class
    }

    /** Point support evaluation. */
    public static double[] evaluate(double[] pci, HermiteMatrix h) {
        return evaluate(pci, h, 1.0);
    }

    /**
     * Evaluates the series at every column of {@code h}.
     *
     * @param pci coefficients, length K+1.
     * @param h Hermite matrix of order K.
     * @param r support coefficient.
     * @return raw-scale values, one per column of {@code h}.
     */
    public static double[] evaluate(double[] pci, HermiteMatrix h, double r) {
        if (pci.length != h.order() + 1)
            throw new IllegalArgumentException("Shape mismatch: PCI length " + pci.length
                    + " for a Hermite matrix of order " + h.order());

        int n = h.size();
        double[] z = new double[n];
        Arrays.fill(z, pci[0]);
        double rp = 1.0;
        for (int p = 1; p < pci.length; p++) {
            rp *= r;
            double c = pci[p] * rp;
            for (int i = 0; i < n; i++) {
                z[i] += c * h.valueAt(p, i);
            }
        }
        return z;
    }

    /** Variance of the expansion: sum of PCI[1..K] squared. */
    public static double variance(double[] pci) {
        double var = 0.0;
        for (int p = 1; p < pci.length; p++) {
            var += pci[p] * pci[p];
        }
        return var;
    }

    /**
     * Block support coefficients {@code PCI[p] * r^p}. PCI[0] is kept as is.
     */
    public static double[] blockCoefficients(double[] pci, double r) {
        double[] out = new double[pci.length];
        out[0] = pci[0];
        double rp = 1.0;
        for (int p = 1; p < pci.length; p++) {
            rp *= r;
            out[p] = pci[p] * rp;
        }
        return out;
    }
}
