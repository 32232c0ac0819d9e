package org.example.ednascan.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.ednascan.exception.ConversionFailedException;
import org.example.ednascan.service.FormatConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delegates conversion to a sidecar service sharing the file system:
 * {@code POST {url}/convert {"input": ..., "output": ...}} answered by
 * {@code {"returncode": 0, "stdout": ..., "stderr": ...}}.
 */
@Service
@ConditionalOnProperty(name = "pipeline.converter.exec", havingValue = "http")
public class HttpFormatConverter implements FormatConverter {

    private static final Logger log = LoggerFactory.getLogger(HttpFormatConverter.class);

    private final String converterUrl;
    private final int timeoutMillis;
    private final ObjectMapper objectMapper;

    public HttpFormatConverter(@Value("${pipeline.converter.url:http://localhost:8001}") String converterUrl,
                               @Value("${pipeline.converter.timeout-seconds:600}") long timeoutSeconds,
                               ObjectMapper objectMapper) {
        this.converterUrl = converterUrl.endsWith("/")
                ? converterUrl.substring(0, converterUrl.length() - 1)
                : converterUrl;
        this.timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeoutSeconds * 1000L);
        this.objectMapper = objectMapper;
    }

    @Override
    public void convert(Path input, Path output) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("input", input.toAbsolutePath().toString());
        payload.put("output", output.toAbsolutePath().toString());

        HttpURLConnection con = null;
        try {
            con = (HttpURLConnection) URI.create(converterUrl + "/convert").toURL().openConnection();
            con.setDoOutput(true);
            con.setRequestMethod("POST");
            con.setConnectTimeout(60_000);
            con.setReadTimeout(timeoutMillis);
            con.setRequestProperty("Content-Type", "application/json");
            try (OutputStream os = con.getOutputStream()) {
                os.write(objectMapper.writeValueAsBytes(payload));
            }

            int code = con.getResponseCode();
            String body;
            try (InputStream is = (code >= 200 && code < 300) ? con.getInputStream() : con.getErrorStream()) {
                body = is == null ? "" : new String(is.readAllBytes(), StandardCharsets.UTF_8);
            }
            log.debug("Converter service answered HTTP {} for {}", code, input.getFileName());

            if (code < 200 || code >= 300) {
                throw new ConversionFailedException("Converter service returned HTTP " + code, body);
            }

            JsonNode node = objectMapper.readTree(body.isBlank() ? "{}" : body);
            int returnCode = node.path("returncode").asInt(0);
            String diagnostics = node.path("stderr").asText("");
            if (returnCode != 0) {
                throw new ConversionFailedException(
                        "Conversion process exited with code " + returnCode, diagnostics);
            }
            if (!Files.exists(output)) {
                throw new ConversionFailedException("Conversion finished but produced no output", diagnostics);
            }
        } catch (IOException e) {
            throw new ConversionFailedException("Converter service call failed", e.getMessage(), e);
        } finally {
            if (con != null) {
                con.disconnect();
            }
        }
    }
}
