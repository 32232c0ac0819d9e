package org.example.ednascan.repository;

import org.example.ednascan.model.Sample;
import org.example.ednascan.model.SampleStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SampleRepository extends JpaRepository<Sample, Long> {
    List<Sample> findByStatusOrderByUploadedAtAsc(SampleStatus status);
    long countByStatus(SampleStatus status);
}
