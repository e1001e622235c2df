package com.marketpulse.exception;

/**
 * Thrown when an analysis is requested before any dataset has been loaded.
 */
public class NoDatasetLoadedException extends MarketPulseException {
    private static final String DEFAULT_ERROR_CODE = "ERR-DS-409";

    public NoDatasetLoadedException(String message) {
        super(message);
    }

    public NoDatasetLoadedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
