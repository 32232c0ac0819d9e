package org.example.ednascan.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "species")
@Getter
@Setter
public class Species {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, unique = true)
    private String scientificName;

    private String commonName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SpeciesCategory category;

    /** IUCN Red List code (CR, EN, VU, NT, LC, ...). */
    @Column(length = 8)
    private String conservationStatus;

    @Column(nullable = false)
    private boolean endangered;

    @Column(nullable = false)
    private boolean invasive;

    @Column(length = 4000)
    private String description;

    private String imageUrl;
}
