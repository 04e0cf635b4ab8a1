package com.geostat.anamorphosis.exceptions;

/**
 * A statistical collaborator reported a nonzero error code.
 */
public class UpstreamComputationException extends RuntimeException {
    private final int errorCode;

    public UpstreamComputationException(String operation, int errorCode, String detail) {
        super(operation + " failed with error code " + errorCode + ": " + detail);
        this.errorCode = errorCode;
    }

    public int getErrorCode() {
        return errorCode;
    }
}
