package org.example.ednascan.service.impl;

import lombok.RequiredArgsConstructor;
import org.example.ednascan.dto.event.PipelineEvent;
import org.example.ednascan.exception.ConversionFailedException;
import org.example.ednascan.exception.PersistenceFailedException;
import org.example.ednascan.exception.PipelineException;
import org.example.ednascan.model.Alert;
import org.example.ednascan.model.Detection;
import org.example.ednascan.model.Sample;
import org.example.ednascan.model.SampleStatus;
import org.example.ednascan.model.SequenceRecord;
import org.example.ednascan.model.Species;
import org.example.ednascan.model.SpeciesMatch;
import org.example.ednascan.repository.AlertRepository;
import org.example.ednascan.repository.DetectionRepository;
import org.example.ednascan.repository.SampleRepository;
import org.example.ednascan.repository.SpeciesRepository;
import org.example.ednascan.service.NotificationBroadcaster;
import org.example.ednascan.service.SequenceFileService;
import org.example.ednascan.service.SpeciesMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

// detections and alerts are committed one by one and survive a later failure
@Service
@RequiredArgsConstructor
public class SamplePipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(SamplePipelineRunner.class);

    private final SampleRepository sampleRepository;
    private final SpeciesRepository speciesRepository;
    private final DetectionRepository detectionRepository;
    private final AlertRepository alertRepository;
    private final SequenceFileService sequenceFileService;
    private final FastaParser fastaParser;
    private final SpeciesMatcher speciesMatcher;
    private final AlertEvaluator alertEvaluator;
    private final NotificationBroadcaster broadcaster;
    private final SampleLockRegistry locks;
    private final Clock clock;

    @Async("pipelineExecutor")
    public void runAsync(Long sampleId, Path uploadedFile, String originalFilename) {
        try {
            process(sampleId, uploadedFile, originalFilename);
        } catch (IllegalStateException | NoSuchElementException e) {
            log.error("Pipeline for sample {} was not started: {}", sampleId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Pipeline for sample {} aborted: {}", sampleId, e.getMessage(), e);
            publish(PipelineEvent.sampleError(sampleId, e.getMessage()));
        }
    }

    public SampleStatus process(Long sampleId, Path uploadedFile, String originalFilename) {
        String token = locks.tryAcquire(sampleId)
                .orElseThrow(() -> new IllegalStateException("Sample " + sampleId + " is already being processed"));
        try {
            Sample sample = updateStatus(sampleId, SampleStatus.PROCESSING, null);
            log.info("Starting processing for sample {}: {}", sampleId, originalFilename);

            try {
                int detections = analyze(sample, uploadedFile, originalFilename);
                log.info("Sample {} completed with {} detections", sampleId, detections);
            } catch (RuntimeException e) {
                markFailed(sampleId, e);
                publish(PipelineEvent.sampleError(sampleId, e.getMessage()));
                return SampleStatus.FAILED;
            }

            deleteUpload(sampleId, uploadedFile);
            publish(PipelineEvent.sampleProcessed(sampleId, SampleStatus.COMPLETED));
            return SampleStatus.COMPLETED;
        } finally {
            locks.release(sampleId, token);
        }
    }

    private int analyze(Sample sample, Path uploadedFile, String originalFilename) {
        Long sampleId = sample.getId();

        Path processed;
        try {
            processed = sequenceFileService.resolve(sampleId, uploadedFile, originalFilename);
        } catch (PipelineException e) {
            sequenceFileService.discard(sampleId);
            throw e;
        }

        List<SequenceRecord> records;
        try {
            records = fastaParser.parse(processed);
        } catch (IOException e) {
            throw new PipelineException("Could not read processed file " + processed.getFileName(), e);
        }
        if (records.isEmpty()) {
            log.warn("Sample {}: no sequence records found in {}", sampleId, processed.getFileName());
        } else {
            log.info("Analyzing {} sequences from sample {}", records.size(), sampleId);
        }

        int detections = detect(sample, records);
        updateStatus(sampleId, SampleStatus.COMPLETED, extensionOf(processed));
        return detections;
    }

    private int detect(Sample sample, List<SequenceRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        List<Species> catalog;
        try {
            catalog = speciesRepository.findAll();
        } catch (DataAccessException e) {
            throw new PersistenceFailedException("Could not load species catalog", e);
        }

        int count = 0;
        for (SequenceRecord record : records) {
            Optional<SpeciesMatch> match = speciesMatcher.match(record, catalog);
            if (match.isEmpty()) {
                continue;
            }
            Species species = match.get().getSpecies();
            Detection detection = save(new Detection(
                    sample.getId(), species.getId(), match.get().getConfidence(), 1, Instant.now(clock)));
            count++;

            for (Alert alert : alertEvaluator.evaluate(detection, species, sample.getLocation())) {
                try {
                    alertRepository.save(alert);
                } catch (DataAccessException e) {
                    throw new PersistenceFailedException(
                            "Could not save alert for detection " + detection.getId(), e);
                }
                log.info("Sample {}: {} alert for {}", sample.getId(), alert.getType().value(),
                        species.getScientificName());
            }
        }
        return count;
    }

    private Detection save(Detection detection) {
        try {
            return detectionRepository.save(detection);
        } catch (DataAccessException e) {
            throw new PersistenceFailedException(
                    "Could not save detection for sample " + detection.getSampleId(), e);
        }
    }

    private Sample updateStatus(Long sampleId, SampleStatus status, String processedFormat) {
        try {
            Sample sample = sampleRepository.findById(sampleId)
                    .orElseThrow(() -> new NoSuchElementException("Sample " + sampleId + " not found"));
            sample.transitionTo(status, Instant.now(clock));
            if (processedFormat != null) {
                sample.setProcessedFormat(processedFormat);
            }
            return sampleRepository.save(sample);
        } catch (DataAccessException e) {
            throw new PersistenceFailedException("Could not update sample " + sampleId + " to " + status.value(), e);
        }
    }

    private void markFailed(Long sampleId, RuntimeException cause) {
        if (cause instanceof ConversionFailedException cfe) {
            log.warn("Sample {} conversion diagnostics:\n{}", sampleId, cfe.getDiagnostics());
        }
        log.error("Error processing sample {}: {}", sampleId, cause.getMessage(), cause);
        try {
            updateStatus(sampleId, SampleStatus.FAILED, null);
        } catch (RuntimeException e) {
            // left in processing; StartupTasks fails it on the next start
            log.error("Could not mark sample {} as failed", sampleId, e);
        }
    }

    private void deleteUpload(Long sampleId, Path uploadedFile) {
        Path dir = uploadedFile.getParent();
        boolean ownDir = dir != null && dir.getFileName() != null
                && dir.getFileName().toString().equals(String.valueOf(sampleId));
        try {
            if (ownDir) {
                FileSystemUtils.deleteRecursively(dir);
            } else {
                Files.deleteIfExists(uploadedFile);
            }
        } catch (IOException e) {
            log.warn("Could not delete original upload {} of sample {}", uploadedFile, sampleId, e);
        }
    }

    private void publish(PipelineEvent event) {
        try {
            broadcaster.publish(event);
        } catch (RuntimeException e) {
            log.warn("Could not publish {} event", event.getType(), e);
        }
    }

    static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int i = name.lastIndexOf('.');
        return (i >= 0) ? name.substring(i).toLowerCase() : "";
    }
}
