package org.example.ednascan.service.impl;

import org.example.ednascan.exception.ConversionFailedException;
import org.example.ednascan.service.FormatConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

// runs <command...> <input> <output>; the merged console output becomes the diagnostics
@Service
@ConditionalOnProperty(name = "pipeline.converter.exec", havingValue = "local", matchIfMissing = true)
public class ProcessFormatConverter implements FormatConverter {

    private static final Logger log = LoggerFactory.getLogger(ProcessFormatConverter.class);
    private static final int MAX_DIAGNOSTIC_CHARS = 8_000;

    private final List<String> command;
    private final long timeoutSeconds;

    public ProcessFormatConverter(@Value("${pipeline.converter.command:python3,scripts/convert_files.py}") String[] command,
                                  @Value("${pipeline.converter.timeout-seconds:600}") long timeoutSeconds) {
        if (command == null || command.length == 0) {
            throw new IllegalArgumentException("pipeline.converter.command must not be empty");
        }
        this.command = List.copyOf(Arrays.asList(command));
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public void convert(Path input, Path output) {
        List<String> cmd = new ArrayList<>(command);
        cmd.add(input.toString());
        cmd.add(output.toString());

        Path logFile = null;
        try {
            logFile = Files.createTempFile("conversion-", ".log");
            log.info("Converting {} -> {} with {}", input.getFileName(), output, String.join(" ", command));

            ProcessBuilder pb = new ProcessBuilder(cmd);
            pb.redirectErrorStream(true);
            pb.redirectOutput(logFile.toFile());

            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                throw new ConversionFailedException(
                        "Failed to start conversion process", e.getMessage(), e);
            }

            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new ConversionFailedException(
                        "Conversion timed out after " + timeoutSeconds + "s", readDiagnostics(logFile));
            }

            int exit = process.exitValue();
            if (exit != 0) {
                throw new ConversionFailedException(
                        "Conversion process exited with code " + exit, readDiagnostics(logFile));
            }
            if (!Files.exists(output)) {
                throw new ConversionFailedException(
                        "Conversion finished but produced no output", readDiagnostics(logFile));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConversionFailedException("Conversion interrupted", "", e);
        } catch (IOException e) {
            throw new ConversionFailedException("Conversion I/O failure", e.getMessage(), e);
        } finally {
            if (logFile != null) {
                try {
                    Files.deleteIfExists(logFile);
                } catch (IOException e) {
                    log.warn("Could not delete conversion log {}", logFile, e);
                }
            }
        }
    }

    private static String readDiagnostics(Path logFile) {
        try {
            String text = Files.readString(logFile, StandardCharsets.UTF_8);
            return text.length() > MAX_DIAGNOSTIC_CHARS
                    ? text.substring(text.length() - MAX_DIAGNOSTIC_CHARS)
                    : text;
        } catch (IOException e) {
            return "(diagnostics unavailable: " + e.getMessage() + ")";
        }
    }
}
