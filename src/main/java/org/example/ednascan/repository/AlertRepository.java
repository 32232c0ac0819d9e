package org.example.ednascan.repository;

import org.example.ednascan.model.Alert;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface AlertRepository extends JpaRepository<Alert, Long> {
    List<Alert> findByReadFalseOrderByCreatedAtDesc();
    long countByReadFalse();
    List<Alert> findAllByOrderByCreatedAtDesc(Pageable pageable);
    List<Alert> findByDetectionIdIn(Collection<Long> detectionIds);

    @Modifying
    @Query("update Alert a set a.read = true where a.id = :id")
    int markRead(@Param("id") Long id);
}
