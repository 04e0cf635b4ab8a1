package com.geostat.anamorphosis.api;

/**
 * A labeled raw-scale series plotted against a Gaussian grid.
 */
public record CurveSeries(String label, double[] values) {

    public CurveSeries {
        values = values.clone();
    }

    @Override
    public double[] values() {
        return values.clone();
    }
}
