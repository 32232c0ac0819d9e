package org.example.ednascan.service;

import org.example.ednascan.model.Detection;
import org.example.ednascan.model.GeoLocation;
import org.example.ednascan.model.Sample;
import org.example.ednascan.model.SampleMetadata;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface SampleService {
    /**
     * Stores the upload, creates the sample as {@code uploaded} and schedules its pipeline once
     * the sample row is committed. Returns without waiting for processing.
     */
    Sample createAndProcess(MultipartFile file, GeoLocation location, SampleMetadata metadata, Long userId) throws IOException;
    Optional<Sample> get(Long id);
    List<Detection> getDetections(Long sampleId);
    List<Detection> getRecentDetections(int limit);
    List<Sample> getProcessing();
}
