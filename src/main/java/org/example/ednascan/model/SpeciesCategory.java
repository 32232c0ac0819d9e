package org.example.ednascan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SpeciesCategory {
    FISH,
    CORAL,
    ALGAE,
    INVERTEBRATE,
    REPTILE,
    MAMMAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SpeciesCategory fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Species category is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
