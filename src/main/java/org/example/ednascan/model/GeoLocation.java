package org.example.ednascan.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class GeoLocation {

    @NotNull(message = "latitude is required")
    @DecimalMin(value = "-90.0", message = "latitude must be between -90 and 90")
    @DecimalMax(value = "90.0", message = "latitude must be between -90 and 90")
    @JsonAlias("lat")
    @Column(name = "latitude")
    private Double latitude;

    @NotNull(message = "longitude is required")
    @DecimalMin(value = "-180.0", message = "longitude must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "longitude must be between -180 and 180")
    @JsonAlias("lng")
    @Column(name = "longitude")
    private Double longitude;

    @Column(name = "location_name")
    private String name;

    /** Used when an alert has no sample location to carry. */
    public static GeoLocation unknown() {
        return new GeoLocation(0.0, 0.0, null);
    }

    public static GeoLocation copyOf(GeoLocation other) {
        if (other == null || other.getLatitude() == null || other.getLongitude() == null) {
            return unknown();
        }
        return new GeoLocation(other.getLatitude(), other.getLongitude(), other.getName());
    }
}
