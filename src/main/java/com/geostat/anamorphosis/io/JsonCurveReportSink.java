package com.geostat.anamorphosis.io;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geostat.anamorphosis.api.CurveReportSink;
import com.geostat.anamorphosis.api.CurveSeries;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

/**
 * Renders curve reports as JSON documents for a plotting front end.
 * <p>
 * Layout:
 *
 * <pre>
 * { "title": ..., "style": {...}, "gauss": [...],
 *   "series": [ { "label": ..., "color": ..., "values": [...] } ] }
 * </pre>
 *
 * NaN values are written as {@code null}.
 */
@Log4j2
public final class JsonCurveReportSink implements CurveReportSink {
    private final ObjectMapper mapper = new ObjectMapper();
    private final ReportStyle style;
    private final Consumer<String> target;

    @Getter
    private String lastReport;

    public JsonCurveReportSink(ReportStyle style, Consumer<String> target) {
        this.style = style;
        this.target = target;
    }

    @Override
    public void publish(String title, double[] gauss, List<CurveSeries> series) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("title", title);
        doc.put("style", style);
        doc.put("gauss", boxed(gauss));

        List<Map<String, Object>> out = new ArrayList<>(series.size());
        for (CurveSeries s : series) {
            double[] values = s.values();
            if (values.length != gauss.length)
                throw new IllegalArgumentException("Series '" + s.label() + "' length " + values.length
                        + " does not match grid length " + gauss.length);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("label", s.label());
            entry.put("color", style.colorFor(s.label()));
            entry.put("values", boxed(values));
            out.add(entry);
        }
        doc.put("series", out);

        try {
            lastReport = mapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render report " + title, e);
        }
        log.debug("Rendered report '{}' with {} series", title, series.size());
        target.accept(lastReport);
    }

    private static Double[] boxed(double[] values) {
        Double[] arr = new Double[values.length];
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            arr[i] = Double.isNaN(v) ? null : v;
        }
        return arr;
    }
}
