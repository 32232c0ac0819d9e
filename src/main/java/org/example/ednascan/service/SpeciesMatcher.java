package org.example.ednascan.service;

import org.example.ednascan.model.SequenceRecord;
import org.example.ednascan.model.Species;
import org.example.ednascan.model.SpeciesMatch;

import java.util.List;
import java.util.Optional;

/**
 * Picks the catalog species a sequence most likely belongs to.
 * <p>
 * A returned match always has a confidence strictly above {@link #ACCEPTANCE_FLOOR}.
 */
public interface SpeciesMatcher {

    double ACCEPTANCE_FLOOR = 0.6;

    Optional<SpeciesMatch> match(SequenceRecord record, List<Species> catalog);
}
