package org.example.ednascan.exception;

public class PersistenceFailedException extends PipelineException {
    public PersistenceFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
