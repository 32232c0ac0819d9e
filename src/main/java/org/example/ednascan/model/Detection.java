package org.example.ednascan.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A catalog species recognised in one sequence record of a sample. Written once, never updated.
 */
@Entity
@Table(name = "detections")
@Getter
@NoArgsConstructor
public class Detection {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "sample_id", nullable = false, updatable = false)
    private Long sampleId;

    @Column(name = "species_id", nullable = false, updatable = false)
    private Long speciesId;

    @Column(nullable = false, updatable = false)
    private double confidence;

    @Column(updatable = false)
    private Integer abundance;

    @Column(nullable = false, updatable = false)
    private Instant detectedAt;

    public Detection(Long sampleId, Long speciesId, double confidence, Integer abundance, Instant detectedAt) {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        this.sampleId = sampleId;
        this.speciesId = speciesId;
        this.confidence = confidence;
        this.abundance = abundance;
        this.detectedAt = detectedAt;
    }
}
