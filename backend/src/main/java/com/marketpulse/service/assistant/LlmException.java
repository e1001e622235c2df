package com.marketpulse.service.assistant;

/** A completion request that failed; worth retrying. */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
