package com.marketpulse.exception;

import lombok.Getter;

/**
 * Base exception for application errors surfaced to API clients.
 * Every subclass carries a stable error code.
 */
@Getter
public abstract class MarketPulseException extends RuntimeException {
    private final String errorCode;

    protected MarketPulseException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected MarketPulseException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected abstract String getDefaultErrorCode();
}
