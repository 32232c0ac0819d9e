package org.example.ednascan.service;

import org.example.ednascan.dto.response.ExternalSpeciesRecord;

import java.util.Optional;

/**
 * Remote species registry queried when a scientific name is not in the local catalog.
 */
public interface SpeciesLookupClient {
    Optional<ExternalSpeciesRecord> find(String scientificName);
}
