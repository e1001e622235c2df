package com.marketpulse.exception;

/**
 * Thrown when a named dataset file does not exist in the upload directory.
 */
public class DatasetNotFoundException extends MarketPulseException {
    private static final String DEFAULT_ERROR_CODE = "ERR-DS-404";

    public DatasetNotFoundException(String message) {
        super(message);
    }

    public DatasetNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
