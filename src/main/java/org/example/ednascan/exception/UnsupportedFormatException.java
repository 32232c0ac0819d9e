package org.example.ednascan.exception;

public class UnsupportedFormatException extends PipelineException {
    public UnsupportedFormatException(String filename) {
        super("Unsupported file format: " + filename);
    }
}
