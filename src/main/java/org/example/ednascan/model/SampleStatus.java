package org.example.ednascan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SampleStatus {
    UPLOADED,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * uploaded -> processing -> {completed | failed}. Nothing else.
     */
    public boolean canTransitionTo(SampleStatus next) {
        return switch (this) {
            case UPLOADED -> next == PROCESSING;
            case PROCESSING -> next.isTerminal();
            case COMPLETED, FAILED -> false;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
