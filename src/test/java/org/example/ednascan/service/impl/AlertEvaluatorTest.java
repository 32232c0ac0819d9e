package org.example.ednascan.service.impl;

import org.example.ednascan.model.Alert;
import org.example.ednascan.model.AlertSeverity;
import org.example.ednascan.model.AlertType;
import org.example.ednascan.model.Detection;
import org.example.ednascan.model.GeoLocation;
import org.example.ednascan.model.Species;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlertEvaluatorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private final AlertEvaluator evaluator = new AlertEvaluator(Clock.fixed(NOW, ZoneOffset.UTC));
    private final Detection detection = new Detection(1L, 2L, 0.8, 1, NOW);

    private static Species species(boolean endangered, boolean invasive) {
        Species s = new Species();
        s.setScientificName("Testus testus");
        s.setEndangered(endangered);
        s.setInvasive(invasive);
        return s;
    }

    @Test
    void endangeredRaisesHighAlertAtSampleLocation() {
        GeoLocation where = new GeoLocation(18.2, -66.5, "Reef A");

        List<Alert> alerts = evaluator.evaluate(detection, species(true, false), where);

        assertEquals(1, alerts.size());
        Alert a = alerts.get(0);
        assertEquals(AlertType.ENDANGERED, a.getType());
        assertEquals(AlertSeverity.HIGH, a.getSeverity());
        assertEquals("Endangered species detected: Testus testus", a.getMessage());
        assertEquals(18.2, a.getLocation().getLatitude());
        assertEquals("Reef A", a.getLocation().getName());
        assertFalse(a.isRead());
        assertEquals(NOW, a.getCreatedAt());
    }

    @Test
    void bothFlagsRaiseEndangeredThenInvasive() {
        List<Alert> alerts = evaluator.evaluate(detection, species(true, true), null);

        assertEquals(List.of(AlertType.ENDANGERED, AlertType.INVASIVE),
                alerts.stream().map(Alert::getType).toList());
        assertEquals(AlertSeverity.MEDIUM, alerts.get(1).getSeverity());
        assertEquals(0.0, alerts.get(1).getLocation().getLatitude());
        assertEquals(0.0, alerts.get(1).getLocation().getLongitude());
    }

    @Test
    void ordinarySpeciesRaisesNothing() {
        assertTrue(evaluator.evaluate(detection, species(false, false), GeoLocation.unknown()).isEmpty());
    }
}
