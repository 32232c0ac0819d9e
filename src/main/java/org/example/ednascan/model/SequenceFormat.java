package org.example.ednascan.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Upload formats the pipeline accepts, recognised by file name suffix.
 */
public enum SequenceFormat {
    ARCHIVE(true, List.of(".tar.gz", ".tgz")),
    FASTA(false, List.of(".fasta", ".fa", ".fas")),
    FASTQ(false, List.of(".fastq", ".fq"));

    public static final String STANDARD_EXTENSION = ".fasta";

    private final boolean needsConversion;
    private final List<String> extensions;

    SequenceFormat(boolean needsConversion, List<String> extensions) {
        this.needsConversion = needsConversion;
        this.extensions = extensions;
    }

    public boolean needsConversion() {
        return needsConversion;
    }

    public static Optional<SequenceFormat> detect(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        for (SequenceFormat f : values()) {
            for (String ext : f.extensions) {
                if (lower.endsWith(ext) && lower.length() > ext.length()) {
                    return Optional.of(f);
                }
            }
        }
        return Optional.empty();
    }

    /** The matched suffix as written in the file name, lower-cased (".tar.gz", ".fasta", ...). */
    public String extensionOf(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (lower.endsWith(ext)) {
                return ext;
            }
        }
        throw new IllegalArgumentException(filename + " is not a " + name() + " file");
    }

    public String baseName(String filename) {
        return filename.substring(0, filename.length() - extensionOf(filename).length());
    }
}
