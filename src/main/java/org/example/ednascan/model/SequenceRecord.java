package org.example.ednascan.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One header/sequence pair read from a FASTA file. Never persisted.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class SequenceRecord {
    private final String header;
    private final String sequence;

    public SequenceRecord(String header, String sequence) {
        this.header = header;
        this.sequence = sequence;
    }

    public int length() {
        return sequence.length();
    }

    /**
     * Fraction of G/C bases, case-insensitive. 0 for an empty sequence.
     */
    public double gcContent() {
        if (sequence.isEmpty()) {
            return 0.0;
        }
        int gc = 0;
        for (int i = 0; i < sequence.length(); i++) {
            char c = sequence.charAt(i);
            if (c == 'G' || c == 'C' || c == 'g' || c == 'c') {
                gc++;
            }
        }
        return gc / (double) sequence.length();
    }
}
