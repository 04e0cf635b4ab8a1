package com.geostat.anamorphosis.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a calibration settings document.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AnamorphosisDefinition {
    private Settings anamorphosis = new Settings();

    /** Calibration settings. Null bounds and mean are computed from the data. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Settings {
        private String name = "anamorphosis";
        private int order = 30;
        private Double practicalMin;
        private Double practicalMax;
        private Double mean;
        private double varianceTolerance = 0.1;
        private int blockGridSize = 1000;
        private ReportStyle style = new ReportStyle();
    }
}
