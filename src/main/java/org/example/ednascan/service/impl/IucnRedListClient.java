package org.example.ednascan.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.ednascan.dto.response.ExternalSpeciesRecord;
import org.example.ednascan.service.SpeciesLookupClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

@Service
public class IucnRedListClient implements SpeciesLookupClient {

    private static final Logger log = LoggerFactory.getLogger(IucnRedListClient.class);

    private final String baseUrl;
    private final String apiKey;
    private final ObjectMapper objectMapper;

    public IucnRedListClient(@Value("${iucn.base-url:https://apiv3.iucnredlist.org/api/v3}") String baseUrl,
                             @Value("${iucn.api-key:}") String apiKey,
                             ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<ExternalSpeciesRecord> find(String scientificName) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("IUCN API key not provided, skipping external species lookup");
            return Optional.empty();
        }

        String name = URLEncoder.encode(scientificName, StandardCharsets.UTF_8).replace("+", "%20");
        String token = URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
        HttpURLConnection con = null;
        try {
            con = (HttpURLConnection) URI.create(baseUrl + "/species/" + name + "?token=" + token)
                    .toURL().openConnection();
            con.setRequestMethod("GET");
            con.setConnectTimeout(10_000);
            con.setReadTimeout(20_000);
            con.setRequestProperty("Accept", "application/json");

            int code = con.getResponseCode();
            if (code < 200 || code >= 300) {
                log.warn("IUCN API returned {} for {}", code, scientificName);
                return Optional.empty();
            }

            JsonNode root;
            try (InputStream is = con.getInputStream()) {
                root = objectMapper.readTree(is);
            }
            return parse(root);
        } catch (IOException e) {
            log.warn("IUCN lookup for {} failed: {}", scientificName, e.getMessage());
            return Optional.empty();
        } finally {
            if (con != null) {
                con.disconnect();
            }
        }
    }

    static Optional<ExternalSpeciesRecord> parse(JsonNode root) {
        JsonNode result = root.path("result");
        if (!result.isArray() || result.isEmpty()) {
            return Optional.empty();
        }
        JsonNode first = result.get(0);
        String scientificName = text(first, "scientific_name");
        if (scientificName == null) {
            return Optional.empty();
        }
        return Optional.of(new ExternalSpeciesRecord(
                scientificName,
                text(first, "main_common_name"),
                text(first, "category"),
                text(first, "narrative")));
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return (v == null || v.isNull() || v.asText().isBlank()) ? null : v.asText();
    }
}
