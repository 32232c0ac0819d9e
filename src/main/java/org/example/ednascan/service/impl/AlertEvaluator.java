package org.example.ednascan.service.impl;

import org.example.ednascan.model.Alert;
import org.example.ednascan.model.AlertSeverity;
import org.example.ednascan.model.AlertType;
import org.example.ednascan.model.Detection;
import org.example.ednascan.model.GeoLocation;
import org.example.ednascan.model.Species;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Component
public class AlertEvaluator {

    private final Clock clock;

    public AlertEvaluator(Clock clock) {
        this.clock = clock;
    }

    public List<Alert> evaluate(Detection detection, Species species, GeoLocation sampleLocation) {
        List<Alert> alerts = new ArrayList<>(2);
        if (species.isEndangered()) {
            alerts.add(build(detection, AlertType.ENDANGERED, AlertSeverity.HIGH,
                    "Endangered species detected: " + species.getScientificName(), sampleLocation));
        }
        if (species.isInvasive()) {
            alerts.add(build(detection, AlertType.INVASIVE, AlertSeverity.MEDIUM,
                    "Invasive species detected: " + species.getScientificName(), sampleLocation));
        }
        return alerts;
    }

    private Alert build(Detection detection, AlertType type, AlertSeverity severity,
                        String message, GeoLocation location) {
        Alert alert = new Alert();
        alert.setDetectionId(detection.getId());
        alert.setType(type);
        alert.setSeverity(severity);
        alert.setMessage(message);
        alert.setLocation(GeoLocation.copyOf(location));
        alert.setRead(false);
        alert.setCreatedAt(Instant.now(clock));
        return alert;
    }
}
