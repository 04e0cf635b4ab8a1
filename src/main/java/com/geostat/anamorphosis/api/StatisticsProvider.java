package com.geostat.anamorphosis.api;

/**
 * Descriptive statistics, optionally weighted.
 */
@FunctionalInterface
public interface StatisticsProvider {
    StatisticsSummary describe(double[] values, double[] weights, boolean useWeights);
}
