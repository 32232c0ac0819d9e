package org.example.ednascan.controller;

import lombok.RequiredArgsConstructor;
import org.example.ednascan.exception.ConversionFailedException;
import org.example.ednascan.exception.UnsupportedFormatException;
import org.example.ednascan.service.SequenceFileService;
import org.example.ednascan.util.Filenames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.FileSystemUtils;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One-off archive to FASTA conversion. Nothing is stored: the work directory is removed
 * before the response is returned.
 */
@RestController
@RequestMapping("/api/convert")
@RequiredArgsConstructor
public class ConversionController {

    private static final Logger log = LoggerFactory.getLogger(ConversionController.class);

    private final SequenceFileService sequenceFileService;

    @PostMapping("/tar-to-fasta")
    public ResponseEntity<Resource> tarToFasta(@RequestParam("file") MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No file uploaded");
        }
        String filename = Filenames.sanitize(file.getOriginalFilename());
        if (filename.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "File name is missing");
        }

        Path workDir = Files.createTempDirectory("ednascan-convert-");
        try {
            Path archive = workDir.resolve(filename);
            file.transferTo(archive);

            Path fasta = sequenceFileService.convertArchive(archive, filename, workDir);
            ByteArrayResource body = new ByteArrayResource(Files.readAllBytes(fasta));

            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            "attachment; filename=\"" + fasta.getFileName() + "\"")
                    .contentType(MediaType.TEXT_PLAIN)
                    .contentLength(body.contentLength())
                    .body(body);
        } catch (UnsupportedFormatException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Please upload a .tar.gz or .tgz archive");
        } catch (ConversionFailedException e) {
            log.warn("Standalone conversion of {} failed: {}\n{}", filename, e.getMessage(), e.getDiagnostics());
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, e.getMessage(), e);
        } finally {
            try {
                FileSystemUtils.deleteRecursively(workDir);
            } catch (IOException e) {
                log.warn("Could not remove conversion work directory {}", workDir, e);
            }
        }
    }
}
