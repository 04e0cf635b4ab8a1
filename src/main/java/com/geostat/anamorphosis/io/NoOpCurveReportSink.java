package com.geostat.anamorphosis.io;

import java.util.List;

import com.geostat.anamorphosis.api.CurveReportSink;
import com.geostat.anamorphosis.api.CurveSeries;

/** Headless sink, drops every report. */
public final class NoOpCurveReportSink implements CurveReportSink {
    public static final NoOpCurveReportSink INSTANCE = new NoOpCurveReportSink();

    private NoOpCurveReportSink() {
    }

    @Override
    public void publish(String title, double[] gauss, List<CurveSeries> series) {
    }
}
