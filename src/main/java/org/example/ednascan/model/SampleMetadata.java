package org.example.ednascan.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

/**
 * Environmental and collection details supplied by the uploader. Every field is optional.
 */
@Embeddable
@Getter
@Setter
public class SampleMetadata {
    private Double temperature;

    @PositiveOrZero(message = "salinity cannot be negative")
    private Double salinity;

    @DecimalMin(value = "0.0", message = "pH must be between 0 and 14")
    @DecimalMax(value = "14.0", message = "pH must be between 0 and 14")
    private Double ph;

    private LocalDate collectionDate;
    private String collector;
    private String equipment;

    @Column(length = 2000)
    private String notes;
}
