package org.example.ednascan.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.example.ednascan.model.SpeciesCategory;

@Getter
@AllArgsConstructor
public class SpeciesDistributionEntry {
    private Long speciesId;
    private SpeciesCategory category;
    private Long count;
}
