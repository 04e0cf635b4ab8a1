package com.geostat.anamorphosis.gslib;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.Variance;

import com.geostat.anamorphosis.api.StatisticsProvider;
import com.geostat.anamorphosis.api.StatisticsSummary;

/**
 * Weighted descriptive statistics.
 *
 * Variance is the population (not bias-corrected) variance, consistent with
 * the variance carried by a Hermite expansion. A quantile at level q is the
 * first sorted value whose normalized cumulative weight reaches q.
 */
public final class WeightedStatistics implements StatisticsProvider {
    public static final double[] DEFAULT_LEVELS = { 0.05, 0.25, 0.5, 0.75, 0.95 };

    private final double[] levels;

    public WeightedStatistics() {
        this(DEFAULT_LEVELS);
    }

    public WeightedStatistics(double[] levels) {
        for (double q : levels) {
            if (!(q >= 0 && q <= 1))
                throw new IllegalArgumentException("Quantile level must be in [0, 1], got " + q);
        }
        this.levels = levels.clone();
    }

    @Override
    public StatisticsSummary describe(double[] values, double[] weights, boolean useWeights) {
        int n = values.length;
        if (n == 0)
            throw new IllegalArgumentException("Values must have length >= 1");
        double[] w;
        if (useWeights) {
            if (weights == null || weights.length != n)
                throw new IllegalArgumentException("Weights length " + (weights == null ? 0 : weights.length)
                        + " does not match values length " + n);
            w = weights;
        } else {
            w = new double[n];
            Arrays.fill(w, 1.0);
        }

        double mean = new Mean().evaluate(values, w);
        double variance = n > 1 ? new Variance(false).evaluate(values, w, mean) : 0.0;
        double cv = mean != 0 ? Math.sqrt(variance) / mean : Double.NaN;

        return new StatisticsSummary(StatUtils.min(values), StatUtils.max(values), cv, mean, variance,
                levels, quantiles(values, w));
    }

    private double[] quantiles(double[] values, double[] w) {
        int n = values.length;
        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(k -> values[k]));

        double total = StatUtils.sum(w);
        double[] cum = new double[n];
        double run = 0.0;
        for (int k = 0; k < n; k++) {
            run += w[order[k]] / total;
            cum[k] = run;
        }

        double[] out = new double[levels.length];
        for (int q = 0; q < levels.length; q++) {
            int k = 0;
            while (k < n - 1 && cum[k] < levels[q])
                k++;
            out[q] = values[order[k]];
        }
        return out;
    }
}
