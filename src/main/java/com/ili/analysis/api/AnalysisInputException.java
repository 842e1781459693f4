package com.ili.analysis.api;

/**
 * Runtime exception thrown when analysis input is unusable, before any computation starts.
 */
public class AnalysisInputException extends RuntimeException {

    public AnalysisInputException(String message) {
        super(message);
    }

    public AnalysisInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
