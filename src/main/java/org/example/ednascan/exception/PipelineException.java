package org.example.ednascan.exception;

/**
 * Base type for failures that end a sample's pipeline run.
 */
public class PipelineException extends RuntimeException {
    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
