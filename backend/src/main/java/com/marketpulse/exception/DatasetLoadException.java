package com.marketpulse.exception;

/**
 * Thrown when a dataset file cannot be read or holds no usable rows.
 */
public class DatasetLoadException extends MarketPulseException {
    private static final String DEFAULT_ERROR_CODE = "ERR-DS-422";

    public DatasetLoadException(String message) {
        super(message);
    }

    public DatasetLoadException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
