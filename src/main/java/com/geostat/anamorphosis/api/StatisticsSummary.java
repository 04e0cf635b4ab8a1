package com.geostat.anamorphosis.api;

import java.util.Arrays;

/**
 * Descriptive statistics of a sample.
 *
 * @param quantileLevels probabilities the quantiles were taken at.
 * @param quantiles      quantile values, one per level.
 */
public record StatisticsSummary(double min, double max, double coefficientOfVariation,
        double mean, double variance, double[] quantileLevels, double[] quantiles) {

    public StatisticsSummary {
        if (quantileLevels.length != quantiles.length)
            throw new IllegalArgumentException("Quantile length mismatch: levels length " + quantileLevels.length
                    + ", quantiles length " + quantiles.length);
        quantileLevels = quantileLevels.clone();
        quantiles = quantiles.clone();
    }

    @Override
    public double[] quantileLevels() {
        return quantileLevels.clone();
    }

    @Override
    public double[] quantiles() {
        return quantiles.clone();
    }

    @Override
    public String toString() {
        return "StatisticsSummary[min=" + min + ", max=" + max + ", cv=" + coefficientOfVariation
                + ", mean=" + mean + ", variance=" + variance
                + ", quantiles=" + Arrays.toString(quantiles) + "]";
    }
}
