package com.processdoc.analyzer.parser.exception;

/**
 * The step container handed to the analyzer is unusable: unreadable, or missing its step list.
 */
public class StepContainerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StepContainerException(String message) {
        super(message);
    }

    public StepContainerException(String message, Throwable cause) {
        super(message, cause);
    }
}
