package org.example.ednascan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertType {
    ENDANGERED,
    INVASIVE,
    BIODIVERSITY_CHANGE,
    ENVIRONMENTAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
