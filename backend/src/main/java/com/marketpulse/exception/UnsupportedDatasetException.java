package com.marketpulse.exception;

/**
 * Thrown for file types the loader does not read.
 */
public class UnsupportedDatasetException extends MarketPulseException {
    private static final String DEFAULT_ERROR_CODE = "ERR-DS-400";

    public UnsupportedDatasetException(String message) {
        super(message);
    }

    public UnsupportedDatasetException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
