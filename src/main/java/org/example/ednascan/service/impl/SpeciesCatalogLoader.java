package org.example.ednascan.service.impl;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.example.ednascan.model.Species;
import org.example.ednascan.model.SpeciesCategory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads species rows from a headed CSV file
 * ({@code name,scientificName,commonName,category,conservationStatus,endangered,invasive,description}).
 */
@Component
public class SpeciesCatalogLoader {

    public List<Species> load(Reader in) throws IOException {
        List<Species> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        try (CSVParser csv = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build()
                .parse(in)) {

            for (CSVRecord r : csv) {
                String scientificName = get(r, "scientificName");
                if (scientificName == null) {
                    throw new IllegalArgumentException("Row " + r.getRecordNumber() + " has no scientificName");
                }
                if (!seen.add(scientificName)) {
                    throw new IllegalArgumentException("Duplicate scientificName " + scientificName);
                }

                Species s = new Species();
                s.setScientificName(scientificName);
                s.setName(firstNonNull(get(r, "name"), scientificName));
                s.setCommonName(get(r, "commonName"));
                s.setCategory(SpeciesCategory.fromValue(get(r, "category")));
                s.setConservationStatus(upper(get(r, "conservationStatus")));
                s.setEndangered(Boolean.parseBoolean(get(r, "endangered")));
                s.setInvasive(Boolean.parseBoolean(get(r, "invasive")));
                s.setDescription(get(r, "description"));
                s.setImageUrl(get(r, "imageUrl"));
                out.add(s);
            }
        }
        return out;
    }

    private static String get(CSVRecord r, String col) {
        if (!r.isMapped(col) || !r.isSet(col)) {
            return null;
        }
        String v = r.get(col);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }

    private static String upper(String v) {
        return v == null ? null : v.toUpperCase(Locale.ROOT);
    }
}
