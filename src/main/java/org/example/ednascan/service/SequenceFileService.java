package org.example.ednascan.service;

import org.example.ednascan.exception.ConversionFailedException;
import org.example.ednascan.exception.UnsupportedFormatException;

import java.nio.file.Path;

public interface SequenceFileService {

    boolean isSupported(String filename);

    /**
     * Produces the flat sequence file for a sample: archives go through the
     * {@link FormatConverter}, flat formats are copied as they are.
     *
     * @return path of the processed file under the sample's processed directory
     */
    Path resolve(Long sampleId, Path uploadedFile, String filename)
            throws ConversionFailedException, UnsupportedFormatException;

    /**
     * Converts an archive outside of any sample, writing the FASTA into {@code outputDir}.
     */
    Path convertArchive(Path archive, String filename, Path outputDir)
            throws ConversionFailedException, UnsupportedFormatException;

    /** Removes whatever {@link #resolve} left behind for the sample. */
    void discard(Long sampleId);
}
