package org.example.ednascan.service.impl;

import lombok.RequiredArgsConstructor;
import org.example.ednascan.model.Detection;
import org.example.ednascan.model.GeoLocation;
import org.example.ednascan.model.Sample;
import org.example.ednascan.model.SampleMetadata;
import org.example.ednascan.model.SampleStatus;
import org.example.ednascan.model.SequenceFormat;
import org.example.ednascan.repository.DetectionRepository;
import org.example.ednascan.repository.SampleRepository;
import org.example.ednascan.service.SampleService;
import org.example.ednascan.util.Filenames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.util.FileSystemUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class SampleServiceImpl implements SampleService {

    private static final Logger log = LoggerFactory.getLogger(SampleServiceImpl.class);

    private static final long MAX_SIZE = 100L * 1024 * 1024; // 100 MB

    @Value("${pipeline.uploads-dir:${pipeline.root:./data}/uploads}")
    private String uploadsDir;

    private final SampleRepository sampleRepository;
    private final DetectionRepository detectionRepository;
    private final SamplePipelineRunner pipelineRunner;
    private final Clock clock;

    private Path uploadsRoot() {
        return Paths.get(uploadsDir).toAbsolutePath().normalize();
    }

    @Override
    @Transactional(rollbackFor = IOException.class)
    public Sample createAndProcess(MultipartFile file, GeoLocation location, SampleMetadata metadata, Long userId) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("No file uploaded");
        }
        if (file.getSize() > MAX_SIZE) {
            throw new IllegalArgumentException("File exceeds the 100 MB upload limit");
        }
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }
        if (location == null || location.getLatitude() == null || location.getLongitude() == null) {
            throw new IllegalArgumentException("Location is required");
        }

        String filename = Filenames.sanitize(file.getOriginalFilename());
        SequenceFormat format = SequenceFormat.detect(filename)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid file type. Please upload .tar.gz, .tgz, .fasta, .fa, .fastq or .fq files."));

        Sample s = new Sample();
        s.setUserId(userId);
        s.setFilename(filename);
        s.setOriginalFormat(format.extensionOf(filename));
        s.setLocation(location);
        s.setMetadata(metadata);
        s.setStatus(SampleStatus.UPLOADED);
        s.setUploadedAt(Instant.now(clock));
        s = sampleRepository.save(s);

        Path sampleDir = uploadsRoot().resolve(String.valueOf(s.getId()));
        Path stored = sampleDir.resolve(filename);
        final Long sampleId = s.getId();
        final String originalFilename = filename;
        // registered first so a failed transfer is cleaned up by the rollback
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                pipelineRunner.runAsync(sampleId, stored, originalFilename);
            }

            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_ROLLED_BACK) {
                    try {
                        FileSystemUtils.deleteRecursively(sampleDir);
                    } catch (IOException e) {
                        log.warn("Could not remove upload directory {} of rolled back sample", sampleDir, e);
                    }
                }
            }
        });

        Files.createDirectories(sampleDir);
        file.transferTo(stored);
        log.info("Stored upload {} for sample {} ({} bytes)", filename, sampleId, file.getSize());

        return s;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Sample> get(Long id) {
        return sampleRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Detection> getDetections(Long sampleId) {
        return detectionRepository.findBySampleIdOrderByConfidenceDesc(sampleId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Detection> getRecentDetections(int limit) {
        return detectionRepository.findAllByOrderByDetectedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Sample> getProcessing() {
        return sampleRepository.findByStatusOrderByUploadedAtAsc(SampleStatus.PROCESSING);
    }
}
