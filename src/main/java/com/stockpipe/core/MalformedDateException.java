package com.stockpipe.core;

/**
 * A date or timestamp value that none of the accepted formats could parse.
 */
public class MalformedDateException extends PipelineException {
    private final String rawValue;

    public MalformedDateException(String rawValue) {
        super("malformed_date: value=" + rawValue);
        this.rawValue = rawValue;
    }

    public MalformedDateException(String rawValue, Throwable cause) {
        super("malformed_date: value=" + rawValue, cause);
        this.rawValue = rawValue;
    }

    public String rawValue() {
        return rawValue;
    }
}
