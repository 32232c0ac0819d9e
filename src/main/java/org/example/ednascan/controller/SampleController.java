package org.example.ednascan.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.example.ednascan.dto.response.SampleStatusResponse;
import org.example.ednascan.model.Detection;
import org.example.ednascan.model.GeoLocation;
import org.example.ednascan.model.Sample;
import org.example.ednascan.model.SampleMetadata;
import org.example.ednascan.service.SampleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/samples")
@RequiredArgsConstructor
public class SampleController {

    private final SampleService sampleService;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    @PostMapping("/upload")
    public ResponseEntity<Sample> upload(@RequestParam("file") MultipartFile file,
                                         @RequestParam("location") String location,
                                         @RequestParam(value = "metadata", required = false) String metadata,
                                         @RequestParam("userId") Long userId) throws IOException {
        GeoLocation loc = readJson(location, GeoLocation.class, "location");
        SampleMetadata meta = (metadata == null || metadata.isBlank())
                ? null
                : readJson(metadata, SampleMetadata.class, "metadata");
        try {
            Sample s = sampleService.createAndProcess(file, loc, meta, userId);
            return ResponseEntity.status(HttpStatus.CREATED).body(s);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @GetMapping("/processing")
    public List<Sample> processing() {
        return sampleService.getProcessing();
    }

    @GetMapping("/{id}")
    public ResponseEntity<Sample> get(@PathVariable Long id) {
        return sampleService.get(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/status")
    public SampleStatusResponse status(@PathVariable Long id) {
        Sample s = sampleService.get(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "sample not found"));
        return SampleStatusResponse.builder()
                .sampleId(s.getId())
                .status(s.getStatus())
                .processedFormat(s.getProcessedFormat())
                .processedAt(s.getProcessedAt())
                .build();
    }

    @GetMapping("/{id}/detections")
    public List<Detection> detections(@PathVariable Long id) {
        if (sampleService.get(id).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "sample not found");
        }
        return sampleService.getDetections(id);
    }

    private <T> T readJson(String json, Class<T> type, String field) {
        T value;
        try {
            value = objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid " + field + " JSON", e);
        }
        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (!violations.isEmpty()) {
            String msg = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, msg);
        }
        return value;
    }
}
