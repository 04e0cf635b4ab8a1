package com.geostat.anamorphosis.exceptions;

/**
 * The fitted curve crosses the empirical curve inside the claimed authorized
 * region. Signals bad practical/authorized bounds; never recovered.
 */
public class ControlPointException extends IllegalStateException {
    public ControlPointException(String message) {
        super("Inconsistent control points: " + message);
    }
}
