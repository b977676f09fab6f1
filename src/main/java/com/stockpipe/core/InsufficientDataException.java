package com.stockpipe.core;

public class InsufficientDataException extends PipelineException {
    private final int required;
    private final int actual;

    public InsufficientDataException(String what, int required, int actual) {
        super("insufficient_data: " + what + " required=" + required + " actual=" + actual);
        this.required = required;
        this.actual = actual;
    }

    public int required() {
        return required;
    }

    public int actual() {
        return actual;
    }
}
