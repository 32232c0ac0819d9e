package org.example.ednascan.repository;

import org.example.ednascan.model.Species;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SpeciesRepository extends JpaRepository<Species, Long> {
    Optional<Species> findByScientificName(String scientificName);
    List<Species> findByEndangeredTrue();
    List<Species> findByInvasiveTrue();
}
