package org.example.ednascan.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SequenceFormatTest {

    @Test
    void detectsArchivesAndFlatFormats() {
        assertEquals(Optional.of(SequenceFormat.ARCHIVE), SequenceFormat.detect("sample1.tar.gz"));
        assertEquals(Optional.of(SequenceFormat.ARCHIVE), SequenceFormat.detect("SAMPLE.TGZ"));
        assertEquals(Optional.of(SequenceFormat.FASTA), SequenceFormat.detect("reads.fa"));
        assertEquals(Optional.of(SequenceFormat.FASTQ), SequenceFormat.detect("reads.fq"));
    }

    @Test
    void rejectsUnknownOrBareExtensions() {
        assertTrue(SequenceFormat.detect("notes.txt").isEmpty());
        assertTrue(SequenceFormat.detect("archive.gz").isEmpty());
        assertTrue(SequenceFormat.detect(".fasta").isEmpty());
        assertTrue(SequenceFormat.detect(null).isEmpty());
    }

    @Test
    void baseNameDropsTheWholeCompoundSuffix() {
        assertEquals(".tar.gz", SequenceFormat.ARCHIVE.extensionOf("reef.Tar.Gz"));
        assertEquals("reef", SequenceFormat.ARCHIVE.baseName("reef.tar.gz"));
        assertEquals("reef.v2", SequenceFormat.FASTA.baseName("reef.v2.fasta"));
    }
}
