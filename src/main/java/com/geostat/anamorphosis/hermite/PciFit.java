package com.geostat.anamorphosis.hermite;

/**
 * Result of {@link PciFitter#fit}: the Hermite coefficients and the standard
 * normal density evaluated on the Gaussian grid.
 */
public final class PciFit {
    private final double[] pci;
    private final double[] density;

    PciFit(double[] pci, double[] density) {
        this.pci = pci;
        this.density = density;
    }

    /** Copy of the coefficient vector, length K+1. */
    public double[] pci() {
        return pci.clone();
    }

    /** Copy of phi(Y[i]) for every grid index; index 0 is not used by the fit and stays 0. */
    public double[] density() {
        return density.clone();
    }

    /** PCI[0], the mean the expansion is centered on. */
    public double mean() {
        return pci[0];
    }

    /** Truncation order K. */
    public int order() {
        return pci.length - 1;
    }

    /** Variance carried by the expansion, sum of PCI[1..K] squared. */
    public double variance() {
        return HermiteExpansion.variance(pci);
    }
}
