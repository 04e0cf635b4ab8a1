package com.geostat.anamorphosis.hermite;

import java.util.OptionalDouble;

import org.apache.commons.math3.stat.StatUtils;

import lombok.extern.log4j.Log4j2;

/**
 * Fits Hermite coefficients (PCI) to an empirical anamorphosis table.
 * <p>
 * Formula, for p = 1..K:
 *
 * <pre>
 * PCI[p] = sum_{i=1}^{N-1} (Z[i-1] - Z[i]) * (1/sqrt(p)) * H[p-1, i] * phi(Y[i])
 * </pre>
 *
 * a Riemann sum over the bins of the table, so the fit sharpens as N grows.
 * PCI[0] is the mean of Z, or the caller's mean when one is given.
 */
@Log4j2
public final class PciFitter {
    static final double ONE_OVER_SQRT_TWO_PI = 0.3989422804014326779399460599343818684758586311649;

    private PciFitter() {
        // Utility class
    }

    /** Fits with PCI[0] = mean(Z). */
    public static PciFit fit(double[] z, double[] y, HermiteMatrix h) {
        return fit(z, y, h, OptionalDouble.empty());
    }

    /**
     * Fits the coefficients.
     *
     * @param z raw values, sorted, right-edge-of-bin convention.
     * @param y Gaussian values paired with {@code z}.
     * @param h Hermite matrix generated from {@code y}.
     * @param mean mean of Z to use for PCI[0]; when empty the mean of {@code z} is computed.
     * @return the coefficients and the density vector.
     */
    public static PciFit fit(double[] z, double[] y, HermiteMatrix h, OptionalDouble mean) {
        int n = z.length;
        if (y.length != n || h.size() != n)
            throw new IllegalArgumentException("Shape mismatch: z length " + n + ", y length " + y.length
                    + ", Hermite columns " + h.size());

        int order = h.order();
        double[] pci = new double[order + 1];
        double[] g = new double[n];

        pci[0] = mean.isPresent() ? mean.getAsDouble() : mean(z);

        for (int i = 1; i < n; i++) {
            g[i] = density(y[i]);
        }
        for (int p = 1; p <= order; p++) {
            double scale = 1.0 / Math.sqrt(p);
            double sum = 0.0;
            for (int i = 1; i < n; i++) {
                sum += (z[i - 1] - z[i]) * scale * h.valueAt(p - 1, i) * g[i];
            }
            pci[p] = sum;
        }

        if (log.isDebugEnabled())
            log.debug("Fitted {} Hermite coefficients on {} bins, mean {}, variance {}",
                    order + 1, n, pci[0], HermiteExpansion.variance(pci));
        return new PciFit(pci, g);
    }

    /** Standard normal density. */
    public static double density(double y) {
        return ONE_OVER_SQRT_TWO_PI * Math.exp(-0.5 * y * y);
    }

    private static double mean(double[] z) {
        if (z.length == 0)
            throw new IllegalArgumentException("Cannot compute the mean of an empty table");
        return StatUtils.mean(z);
    }
}
