package org.example.ednascan.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ExternalSpeciesRecord {
    private final String scientificName;
    private final String commonName;
    private final String conservationStatus;
    private final String description;
}
