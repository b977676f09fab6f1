package com.stockpipe.core;

/**
 * Retryable failure of an outbound call: timeout, connection reset, rate limiting, 5xx,
 * or an empty/malformed body.
 */
public class TransientFetchException extends PipelineException {
    private final String category;

    public TransientFetchException(String category, String message) {
        super(message);
        this.category = category == null ? "other" : category;
    }

    public TransientFetchException(String category, String message, Throwable cause) {
        super(message, cause);
        this.category = category == null ? "other" : category;
    }

    public String category() {
        return category;
    }
}
