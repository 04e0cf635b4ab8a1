package com.geostat.anamorphosis.api;

import com.geostat.anamorphosis.exceptions.UpstreamComputationException;

/**
 * Normal-score transform and back transform through a transformation table.
 */
public interface NormalScoreTransform {
    /**
     * Raw values to Gaussian scores.
     *
     * @throws UpstreamComputationException if the computation reports an error code.
     */
    double[] forward(double[] values, TransformTable table);

    /**
     * Gaussian scores to raw values, with tail extrapolation beyond the table.
     *
     * @throws UpstreamComputationException if the computation reports an error code.
     */
    double[] backward(double[] values, TransformTable table, TailModel tails);
}
