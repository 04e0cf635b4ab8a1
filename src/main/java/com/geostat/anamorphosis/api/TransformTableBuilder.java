package com.geostat.anamorphosis.api;

import com.geostat.anamorphosis.exceptions.UpstreamComputationException;

/**
 * Builds the empirical transformation table from declustered data.
 */
@FunctionalInterface
public interface TransformTableBuilder {
    /**
     * @param raw     raw values, any order.
     * @param weights declustering weights, one per value.
     * @return the sorted raw values paired with their Gaussian scores.
     * @throws UpstreamComputationException if the computation reports an error code.
     */
    TransformTable build(double[] raw, double[] weights);
}
