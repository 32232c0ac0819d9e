package org.example.ednascan.repository;

import org.example.ednascan.dto.response.SpeciesDistributionEntry;
import org.example.ednascan.model.Detection;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface DetectionRepository extends JpaRepository<Detection, Long> {
    List<Detection> findBySampleIdOrderByConfidenceDesc(Long sampleId);
    List<Detection> findAllByOrderByDetectedAtDesc(Pageable pageable);
    long countBySampleId(Long sampleId);

    @Query("select new org.example.ednascan.dto.response.SpeciesDistributionEntry(d.speciesId, s.category, count(d)) "
            + "from Detection d, Species s where s.id = d.speciesId "
            + "group by d.speciesId, s.category order by count(d) desc, d.speciesId")
    List<SpeciesDistributionEntry> speciesDistribution();
}
