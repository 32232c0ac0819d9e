package org.example.ednascan.controller;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.example.ednascan.model.Alert;
import org.example.ednascan.service.AlertService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final AlertService alertService;

    @GetMapping
    public List<Alert> recent(@RequestParam(defaultValue = "20") @Min(1) @Max(500) int limit) {
        return alertService.getRecent(limit);
    }

    @GetMapping("/unread")
    public List<Alert> unread() {
        return alertService.getUnread();
    }

    @GetMapping("/sample/{sampleId}")
    public List<Alert> forSample(@PathVariable Long sampleId) {
        return alertService.getForSample(sampleId);
    }

    @PatchMapping("/{id}/read")
    public ResponseEntity<Map<String, Object>> markRead(@PathVariable Long id) {
        if (!alertService.markAsRead(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "alert not found");
        }
        return ResponseEntity.ok(Map.of("id", id, "read", true));
    }
}
