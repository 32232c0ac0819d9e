package org.example.ednascan.controller;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.example.ednascan.dto.response.SpeciesDistributionEntry;
import org.example.ednascan.model.Detection;
import org.example.ednascan.model.Species;
import org.example.ednascan.service.SampleService;
import org.example.ednascan.service.SpeciesService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/species")
@RequiredArgsConstructor
public class SpeciesController {

    private final SpeciesService speciesService;
    private final SampleService sampleService;

    @GetMapping
    public List<Species> all() {
        return speciesService.listAll();
    }

    @GetMapping("/endangered")
    public List<Species> endangered() {
        return speciesService.listEndangered();
    }

    @GetMapping("/invasive")
    public List<Species> invasive() {
        return speciesService.listInvasive();
    }

    @GetMapping("/distribution")
    public List<SpeciesDistributionEntry> distribution() {
        return speciesService.getDistribution();
    }

    @GetMapping("/lookup")
    public Species lookup(@RequestParam @NotBlank String scientificName) {
        return speciesService.getSpeciesInfo(scientificName.trim())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "species not found"));
    }

    @GetMapping("/detected")
    public List<Detection> detected(@RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return sampleService.getRecentDetections(limit);
    }
}
