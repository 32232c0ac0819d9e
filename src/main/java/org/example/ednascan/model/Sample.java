package org.example.ednascan.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "samples")
@Getter
@Setter
public class Sample {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false)
    private String filename;

    @Column(nullable = false)
    private String originalFormat;

    private String processedFormat;

    @Embedded
    private GeoLocation location;

    @Embedded
    private SampleMetadata metadata;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SampleStatus status = SampleStatus.UPLOADED;

    @Column(nullable = false)
    private Instant uploadedAt;

    private Instant processedAt;

    /**
     * Moves the sample along its lifecycle. {@code processedAt} is stamped when a terminal
     * status is reached.
     *
     * @throws IllegalStateException if the move is not {@code uploaded -> processing} or
     *                               {@code processing -> completed|failed}
     */
    public void transitionTo(SampleStatus next, Instant at) {
        if (status == null || !status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Sample " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
        if (next.isTerminal()) {
            processedAt = at;
        }
    }
}
