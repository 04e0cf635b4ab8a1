package com.geostat.anamorphosis.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * Visual settings of a curve report, one field per channel.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ReportStyle {
    private String rawColor = "#1f77b4";
    private String modelColor = "#ff7f0e";
    private String blockColor = "#2ca02c";
    private String controlPointColor = "#d62728";
    private String defaultColor = "#7f7f7f";
    private double lineWidth = 1.5;
    private boolean showControlPoints = true;

    /** Color of a series, picked by its label prefix. */
    public String colorFor(String label) {
        if (label.startsWith("raw"))
            return rawColor;
        if (label.startsWith("model"))
            return modelColor;
        if (label.startsWith("block"))
            return blockColor;
        if (label.startsWith("control"))
            return controlPointColor;
        return defaultColor;
    }
}
