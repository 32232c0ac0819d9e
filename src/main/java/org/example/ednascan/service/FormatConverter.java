package org.example.ednascan.service;

import org.example.ednascan.exception.ConversionFailedException;

import java.nio.file.Path;

/**
 * Turns a compressed sequence archive into a flat FASTA file.
 * <p>
 * Implementations either drive an external tool or decode in-process; callers only see the
 * path-in, path-out contract. Success means {@code output} exists when the call returns.
 * Nothing is retried and partial output is left for the caller to discard.
 */
public interface FormatConverter {
    void convert(Path input, Path output) throws ConversionFailedException;
}
