package com.geostat.anamorphosis.effect;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.NoBracketingException;

import lombok.extern.log4j.Log4j2;

/**
 * Solves the support and information effect coefficients of a Hermite
 * anamorphosis.
 * <p>
 * Identities, with PCI the point support coefficients:
 *
 * <pre>
 * Var(Zv)         = sum_p PCI[p]^2 * r^(2p)                 -> r  (support effect)
 * Var(Zv*)        = sum_p PCI[p]^2 * s^(2p)                 -> s  (smoothing)
 * Cov(Zv, Zv*)    = sum_p PCI[p]^2 * r^p * s^p * ro^p       -> ro (conditional bias)
 * </pre>
 *
 * Each residual is increasing on [0, 1] for a decaying PCI spectrum and is
 * solved with Brent's method on that bracket. A target outside the range of
 * the residual has no sign change over [0, 1]; the solver's
 * {@link NoBracketingException} is propagated unchanged.
 */
@Log4j2
public final class EffectCoefficientSolver {
    public static final double DEFAULT_ABSOLUTE_ACCURACY = 1e-12;
    public static final int DEFAULT_MAX_EVALUATIONS = 200;

    private final double absoluteAccuracy;
    private final int maxEvaluations;

    public EffectCoefficientSolver() {
        this(DEFAULT_ABSOLUTE_ACCURACY, DEFAULT_MAX_EVALUATIONS);
    }

    public EffectCoefficientSolver(double absoluteAccuracy, int maxEvaluations) {
        if (absoluteAccuracy <= 0)
            throw new IllegalArgumentException("Absolute accuracy must be > 0");
        if (maxEvaluations < 1)
            throw new IllegalArgumentException("Max evaluations must be >= 1");
        this.absoluteAccuracy = absoluteAccuracy;
        this.maxEvaluations = maxEvaluations;
    }

    /**
     * Support effect coefficient {@code r} for a target block variance.
     *
     * @param blockVariance Var(Zv), at least 0.
     * @param pci point support coefficients.
     * @return r in [0, 1].
     * @throws NoBracketingException if the target exceeds the point variance.
     */
    public double solveSupport(double blockVariance, double[] pci) {
        checkTarget("Block variance", blockVariance);
        double r = solve(x -> powerSeries(pci, x * x) - blockVariance);
        log.debug("Support coefficient r={} for block variance {}", r, blockVariance);
        return r;
    }

    /**
     * Smoothing coefficient {@code s} for the variance of the block estimates.
     *
     * @param estimateVariance Var(Zv*), at least 0.
     * @param pci point support coefficients.
     * @return s in [0, 1].
     */
    public double solveSmoothing(double estimateVariance, double[] pci) {
        checkTarget("Estimate variance", estimateVariance);
        double s = solve(x -> powerSeries(pci, x * x) - estimateVariance);
        log.debug("Smoothing coefficient s={} for estimate variance {}", s, estimateVariance);
        return s;
    }

    /**
     * Conditional bias coefficient {@code ro} given {@code r} and {@code s}.
     *
     * @param covariance Cov(Zv, Zv*), at least 0.
     * @param pci point support coefficients.
     * @param r support coefficient, in [0, 1].
     * @param s smoothing coefficient, in [0, 1].
     * @return ro in [0, 1].
     */
    public double solveConditionalBias(double covariance, double[] pci, double r, double s) {
        checkTarget("Block covariance", covariance);
        checkUnit("r", r);
        checkUnit("s", s);
        double rs = r * s;
        double ro = solve(x -> powerSeries(pci, rs * x) - covariance);
        log.debug("Conditional bias coefficient ro={} for covariance {} (r={}, s={})", ro, covariance, r, s);
        return ro;
    }

    /** {@code sum_{p>=1} PCI[p]^2 * t^p}. */
    static double powerSeries(double[] pci, double t) {
        double sum = 0.0;
        double tp = 1.0;
        for (int p = 1; p < pci.length; p++) {
            tp *= t;
            sum += pci[p] * pci[p] * tp;
        }
        return sum;
    }

    private double solve(UnivariateFunction residual) {
        return new BrentSolver(absoluteAccuracy).solve(maxEvaluations, residual, 0.0, 1.0);
    }

    private static void checkTarget(String what, double value) {
        if (!(value >= 0))
            throw new IllegalArgumentException(what + " must be >= 0, got " + value);
    }

    private static void checkUnit(String what, double value) {
        if (!(value >= 0 && value <= 1))
            throw new IllegalArgumentException(what + " must be in [0, 1], got " + value);
    }
}
