package com.geostat.anamorphosis.io;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geostat.anamorphosis.api.CurveSeries;

import static org.junit.Assert.*;

public class JsonCurveReportSinkTest {

    @Test
    public void testPublish() throws Exception {
        List<String> published = new ArrayList<>();
        JsonCurveReportSink sink = new JsonCurveReportSink(new ReportStyle(), published::add);

        sink.publish("demo", new double[] { -1, 0, 1 },
                List.of(new CurveSeries("raw", new double[] { 1, 2, 3 }),
                        new CurveSeries("model", new double[] { 1.1, Double.NaN, 2.9 })));

        assertEquals(1, published.size());
        assertEquals(published.get(0), sink.getLastReport());

        JsonNode doc = new ObjectMapper().readTree(sink.getLastReport());
        assertEquals("demo", doc.get("title").asText());
        assertEquals(3, doc.get("gauss").size());
        assertEquals(1.5, doc.get("style").get("lineWidth").asDouble(), 0.0);

        JsonNode series = doc.get("series");
        assertEquals(2, series.size());
        assertEquals("raw", series.get(0).get("label").asText());
        assertEquals("#1f77b4", series.get(0).get("color").asText());
        assertEquals("#ff7f0e", series.get(1).get("color").asText());
        assertTrue(series.get(1).get("values").get(1).isNull());
        assertEquals(2.9, series.get(1).get("values").get(2).asDouble(), 0.0);
    }

    @Test
    public void testSeriesLengthMismatch() {
        JsonCurveReportSink sink = new JsonCurveReportSink(new ReportStyle(), s -> { });
        try {
            sink.publish("bad", new double[] { 0, 1 }, List.of(new CurveSeries("raw", new double[] { 1 })));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("length"));
        }
        assertNull(sink.getLastReport());
    }

    @Test
    public void testColorByPrefix() {
        ReportStyle style = new ReportStyle();

        assertEquals(style.getBlockColor(), style.colorFor("block r=0.8"));
        assertEquals(style.getControlPointColor(), style.colorFor("control points"));
        assertEquals(style.getDefaultColor(), style.colorFor("other"));
    }
}
