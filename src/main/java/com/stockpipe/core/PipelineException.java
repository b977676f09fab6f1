package com.stockpipe.core;

/**
 * Base of every failure raised by the pipeline itself. Storage failures stay {@link java.sql.SQLException}.
 */
public class PipelineException extends RuntimeException {
    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
