package org.example.ednascan.service.impl;

import org.example.ednascan.exception.ConversionFailedException;
import org.example.ednascan.exception.UnsupportedFormatException;
import org.example.ednascan.model.SequenceFormat;
import org.example.ednascan.service.FormatConverter;
import org.example.ednascan.service.SequenceFileService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

@Service
public class SequenceFileServiceImpl implements SequenceFileService {

    private static final Logger log = LoggerFactory.getLogger(SequenceFileServiceImpl.class);

    private final FormatConverter converter;
    private final Path processedDir;

    public SequenceFileServiceImpl(FormatConverter converter,
                                   @Value("${pipeline.processed-dir:${pipeline.root:./data}/processed}") String processedDir) {
        this.converter = converter;
        this.processedDir = Paths.get(processedDir).toAbsolutePath().normalize();
    }

    @Override
    public boolean isSupported(String filename) {
        return SequenceFormat.detect(filename).isPresent();
    }

    @Override
    public Path resolve(Long sampleId, Path uploadedFile, String filename) {
        SequenceFormat format = SequenceFormat.detect(filename)
                .orElseThrow(() -> new UnsupportedFormatException(filename));

        Path sampleDir = sampleDir(sampleId);
        try {
            Files.createDirectories(sampleDir);
        } catch (IOException e) {
            throw new ConversionFailedException("Cannot create processed directory", e.getMessage(), e);
        }

        String safeName = Paths.get(filename).getFileName().toString();
        if (format.needsConversion()) {
            Path output = sampleDir.resolve(format.baseName(safeName) + SequenceFormat.STANDARD_EXTENSION);
            converter.convert(uploadedFile, output);
            log.info("Converted {} to {}", filename, output.getFileName());
            return output;
        }

        Path output = sampleDir.resolve(safeName);
        try {
            Files.copy(uploadedFile, output, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new ConversionFailedException("Could not copy " + filename, e.getMessage(), e);
        }
        return output;
    }

    @Override
    public Path convertArchive(Path archive, String filename, Path outputDir) {
        SequenceFormat format = SequenceFormat.detect(filename)
                .filter(SequenceFormat::needsConversion)
                .orElseThrow(() -> new UnsupportedFormatException(filename));
        String safeName = Paths.get(filename).getFileName().toString();
        Path output = outputDir.resolve(format.baseName(safeName) + SequenceFormat.STANDARD_EXTENSION);
        converter.convert(archive, output);
        return output;
    }

    @Override
    public void discard(Long sampleId) {
        Path dir = sampleDir(sampleId);
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            log.warn("Could not remove processed output {} for sample {}", dir, sampleId, e);
        }
    }

    private Path sampleDir(Long sampleId) {
        return processedDir.resolve(String.valueOf(sampleId));
    }
}
