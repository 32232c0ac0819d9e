package org.example.ednascan.exception;

/**
 * The external converter exited non-zero, could not be started, timed out, or produced no output.
 * {@link #getDiagnostics()} holds whatever the tool printed; it is meant for logs, not end users.
 */
public class ConversionFailedException extends PipelineException {
    private final String diagnostics;

    public ConversionFailedException(String message, String diagnostics) {
        super(message);
        this.diagnostics = diagnostics == null ? "" : diagnostics;
    }

    public ConversionFailedException(String message, String diagnostics, Throwable cause) {
        super(message, cause);
        this.diagnostics = diagnostics == null ? "" : diagnostics;
    }

    public String getDiagnostics() {
        return diagnostics;
    }
}
