package org.example.ednascan.service;

import org.example.ednascan.dto.response.SpeciesDistributionEntry;
import org.example.ednascan.model.Species;

import java.util.List;
import java.util.Optional;

public interface SpeciesService {
    List<Species> listAll();
    List<Species> listEndangered();
    List<Species> listInvasive();
    List<SpeciesDistributionEntry> getDistribution();

    /** Local catalog first, then the remote registry; a remote hit is added to the catalog. */
    Optional<Species> getSpeciesInfo(String scientificName);

    /** Inserts the bundled catalog when no species exist yet. @return rows inserted */
    int seedIfEmpty();
}
