package com.geostat.anamorphosis.api;

import java.util.List;

/**
 * Receives curves for visualization. Takes no part in any computation.
 */
@FunctionalInterface
public interface CurveReportSink {
    /**
     * @param title  report title.
     * @param gauss  Gaussian grid shared by every series.
     * @param series raw-scale series, each as long as {@code gauss}.
     */
    void publish(String title, double[] gauss, List<CurveSeries> series);
}
