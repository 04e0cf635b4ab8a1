package com.geostat.anamorphosis.gslib;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

import org.apache.commons.math3.distribution.NormalDistribution;

import com.geostat.anamorphosis.api.TransformTable;
import com.geostat.anamorphosis.api.TransformTableBuilder;
import com.geostat.anamorphosis.exceptions.UpstreamComputationException;

import lombok.extern.log4j.Log4j2;

/**
 * Weighted normal-score transformation table, GSLIB style.
 * <p>
 * Values are sorted (weights follow), weights normalized to sum 1, and each
 * value gets the Gaussian quantile of the midpoint of its cumulative weight
 * step:
 *
 * <pre>
 * p[k] = (W[k-1] + W[k]) / 2,   y[k] = inverseNormal(p[k])
 * </pre>
 */
@Log4j2
public final class NormalScoreTableBuilder implements TransformTableBuilder {
    public static final int ERR_LENGTH_MISMATCH = 1;
    public static final int ERR_NEGATIVE_WEIGHT = 2;
    public static final int ERR_ZERO_TOTAL_WEIGHT = 3;
    public static final int ERR_EMPTY = 4;

    private static final String OPERATION = "Normal score table";

    private final NormalDistribution standard = new NormalDistribution(null, 0.0, 1.0,
            NormalDistribution.DEFAULT_INVERSE_ABSOLUTE_ACCURACY);

    /** Equal weights. */
    public TransformTable build(double[] raw) {
        double[] w = new double[raw.length];
        Arrays.fill(w, 1.0);
        return build(raw, w);
    }

    @Override
    public TransformTable build(double[] raw, double[] weights) {
        int n = raw.length;
        if (n == 0)
            throw new UpstreamComputationException(OPERATION, ERR_EMPTY, "no data");
        if (weights.length != n)
            throw new UpstreamComputationException(OPERATION, ERR_LENGTH_MISMATCH,
                    "raw length " + n + ", weights length " + weights.length);

        double total = 0.0;
        for (double w : weights) {
            if (!(w >= 0))
                throw new UpstreamComputationException(OPERATION, ERR_NEGATIVE_WEIGHT, "weight " + w);
            total += w;
        }
        if (!(total > 0))
            throw new UpstreamComputationException(OPERATION, ERR_ZERO_TOTAL_WEIGHT, "total weight " + total);

        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(k -> raw[k]));

        double[] z = new double[n];
        double[] y = new double[n];
        double cum = 0.0;
        for (int k = 0; k < n; k++) {
            int src = order[k];
            double prev = cum;
            cum += weights[src] / total;
            z[k] = raw[src];
            y[k] = standard.inverseCumulativeProbability(clampProbability(0.5 * (prev + cum)));
        }

        log.debug("Built normal score table of {} values, raw range [{}, {}]", n, z[0], z[n - 1]);
        return new TransformTable(z, y);
    }

    // Zero-weight values at the ends would map to infinite scores.
    private static double clampProbability(double p) {
        return Math.min(Math.max(p, 1e-12), 1.0 - 1e-12);
    }
}
