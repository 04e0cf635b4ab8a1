package com.geostat.anamorphosis;

/**
 * Support and information effect coefficients of one calibration.
 *
 * @param r  support effect.
 * @param s  smoothing of the block estimates.
 * @param ro conditional bias correlation.
 */
public record InformationEffect(double r, double s, double ro) {
}
