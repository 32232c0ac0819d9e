package org.example.ednascan.support;

import org.example.ednascan.model.GeoLocation;
import org.example.ednascan.model.Sample;
import org.example.ednascan.model.SampleStatus;
import org.example.ednascan.model.Species;
import org.example.ednascan.model.SpeciesCategory;

import java.time.Instant;

public final class TestData {

    /** Matches a fish at 0.7 under {@link TestPipelineConfig}. */
    public static final String FISH_RECORD = ">amplicon_1\n" + "ACGT".repeat(75) + "\n";
    /** Too short and AT-rich to match anything. */
    public static final String NOISE_RECORD = ">amplicon_2\n" + "AT".repeat(25) + "\n";

    private TestData() {
    }

    public static Species species(String scientificName, SpeciesCategory category,
                                  boolean endangered, boolean invasive) {
        Species s = new Species();
        s.setName(scientificName);
        s.setScientificName(scientificName);
        s.setCategory(category);
        s.setEndangered(endangered);
        s.setInvasive(invasive);
        return s;
    }

    public static Sample sample(String filename, String originalFormat, SampleStatus status) {
        Sample s = new Sample();
        s.setUserId(1L);
        s.setFilename(filename);
        s.setOriginalFormat(originalFormat);
        s.setLocation(new GeoLocation(18.47, -66.12, "San Juan Bay"));
        s.setStatus(status);
        s.setUploadedAt(Instant.now());
        return s;
    }
}
