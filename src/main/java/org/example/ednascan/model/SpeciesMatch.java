package org.example.ednascan.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SpeciesMatch {
    private final Species species;
    private final double confidence;
}
