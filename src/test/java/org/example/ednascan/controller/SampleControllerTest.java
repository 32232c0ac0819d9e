package org.example.ednascan.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.ednascan.model.SpeciesCategory;
import org.example.ednascan.repository.AlertRepository;
import org.example.ednascan.repository.DetectionRepository;
import org.example.ednascan.repository.SampleRepository;
import org.example.ednascan.repository.SpeciesRepository;
import org.example.ednascan.support.RecordingBroadcaster;
import org.example.ednascan.support.ScriptedConverter;
import org.example.ednascan.support.TestData;
import org.example.ednascan.support.TestPipelineConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestPipelineConfig.class)
class SampleControllerTest {

    private static final String LOCATION = "{\"lat\":18.47,\"lng\":-66.12,\"name\":\"San Juan Bay\"}";

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper om;
    @Autowired SampleRepository sampleRepository;
    @Autowired SpeciesRepository speciesRepository;
    @Autowired DetectionRepository detectionRepository;
    @Autowired AlertRepository alertRepository;
    @Autowired ScriptedConverter converter;
    @Autowired RecordingBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        alertRepository.deleteAll();
        detectionRepository.deleteAll();
        sampleRepository.deleteAll();
        speciesRepository.deleteAll();
        broadcaster.clear();
        speciesRepository.save(TestData.species("Eretmochelys imbricata", SpeciesCategory.FISH, true, false));
    }

    private JsonNode json(MvcResult r) throws Exception {
        return om.readTree(r.getResponse().getContentAsString());
    }

    private JsonNode awaitTerminal(long id) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        while (true) {
            JsonNode status = json(mvc.perform(get("/api/samples/{id}/status", id))
                    .andExpect(status().isOk())
                    .andReturn());
            String s = status.get("status").asText();
            if (s.equals("completed") || s.equals("failed")) {
                return status;
            }
            if (System.currentTimeMillis() > deadline) {
                fail("sample " + id + " still " + s);
            }
            Thread.sleep(50);
        }
    }

    @Test
    void uploadReturnsImmediatelyAndCompletesInTheBackground() throws Exception {
        converter.produce(TestData.FISH_RECORD + TestData.NOISE_RECORD);
        MockMultipartFile file = new MockMultipartFile(
                "file", "sample1.tar.gz", "application/gzip", "archive".getBytes(StandardCharsets.UTF_8));

        JsonNode created = json(mvc.perform(multipart("/api/samples/upload")
                        .file(file)
                        .param("location", LOCATION)
                        .param("metadata", "{\"temperature\":27.5,\"collectionDate\":\"2024-05-01\"}")
                        .param("userId", "1"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("uploaded"))
                .andExpect(jsonPath("$.originalFormat").value(".tar.gz"))
                .andExpect(jsonPath("$.location.latitude").value(18.47))
                .andReturn());
        long id = created.get("id").asLong();

        JsonNode status = awaitTerminal(id);
        assertEquals("completed", status.get("status").asText());
        assertEquals(".fasta", status.get("processedFormat").asText());

        mvc.perform(get("/api/samples/{id}/detections", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].confidence", closeTo(0.7, 1e-9)));

        JsonNode unread = json(mvc.perform(get("/api/alerts/unread")).andExpect(status().isOk()).andReturn());
        assertEquals(1, unread.size());
        assertEquals("endangered", unread.get(0).get("type").asText());
        assertEquals("high", unread.get(0).get("severity").asText());

        long alertId = unread.get(0).get("id").asLong();
        mvc.perform(patch("/api/alerts/{id}/read", alertId)).andExpect(status().isOk());
        mvc.perform(get("/api/alerts/unread")).andExpect(jsonPath("$.length()").value(0));
        mvc.perform(get("/api/alerts").param("limit", "5")).andExpect(jsonPath("$[0].read").value(true));
        mvc.perform(get("/api/alerts/sample/{id}", id)).andExpect(jsonPath("$.length()").value(1));
        mvc.perform(get("/api/species/detected")).andExpect(jsonPath("$.length()").value(1));
        mvc.perform(get("/api/samples/processing")).andExpect(jsonPath("$.length()").value(0));

        assertTrue(broadcaster.eventsFor(id).stream().anyMatch(e -> e.getType().equals("sample_processed")));
    }

    @Test
    void failedConversionIsVisibleThroughStatus() throws Exception {
        converter.failWith("Conversion process exited with code 1");
        MockMultipartFile file = new MockMultipartFile(
                "file", "bad.tgz", "application/gzip", "junk".getBytes(StandardCharsets.UTF_8));

        long id = json(mvc.perform(multipart("/api/samples/upload")
                        .file(file).param("location", LOCATION).param("userId", "2"))
                .andExpect(status().isCreated())
                .andReturn()).get("id").asLong();

        assertEquals("failed", awaitTerminal(id).get("status").asText());
        mvc.perform(get("/api/samples/{id}/detections", id)).andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void unsupportedExtensionIsRejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile(
                "file", "notes.txt", "text/plain", "hello".getBytes(StandardCharsets.UTF_8));

        mvc.perform(multipart("/api/samples/upload").file(file).param("location", LOCATION).param("userId", "1"))
                .andExpect(status().isBadRequest());
        assertEquals(0, sampleRepository.count());
    }

    @Test
    void malformedLocationIsRejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile(
                "file", "reads.fasta", "text/plain", TestData.FISH_RECORD.getBytes(StandardCharsets.UTF_8));

        mvc.perform(multipart("/api/samples/upload").file(file).param("location", "{lat:").param("userId", "1"))
                .andExpect(status().isBadRequest());
        mvc.perform(multipart("/api/samples/upload").file(file).param("location", "{}").param("userId", "1"))
                .andExpect(status().isBadRequest());
        mvc.perform(multipart("/api/samples/upload").file(file)
                        .param("location", "{\"lat\":123.0,\"lng\":10.0}").param("userId", "1"))
                .andExpect(status().isBadRequest());
        mvc.perform(multipart("/api/samples/upload").file(file)
                        .param("location", LOCATION).param("metadata", "{\"ph\":15}").param("userId", "1"))
                .andExpect(status().isBadRequest());
        assertEquals(0, sampleRepository.count());
    }

    @Test
    void unknownIdsAreNotFound() throws Exception {
        mvc.perform(get("/api/samples/{id}", 424242)).andExpect(status().isNotFound());
        mvc.perform(get("/api/samples/{id}/status", 424242)).andExpect(status().isNotFound());
        mvc.perform(patch("/api/alerts/{id}/read", 424242)).andExpect(status().isNotFound());
        mvc.perform(get("/api/species/lookup").param("scientificName", "Thunnus thynnus"))
                .andExpect(status().isNotFound());
    }

    @Test
    void listLimitsAreBounded() throws Exception {
        mvc.perform(get("/api/alerts").param("limit", "0")).andExpect(status().isBadRequest());
        mvc.perform(get("/api/species/detected").param("limit", "100000")).andExpect(status().isBadRequest());
        mvc.perform(get("/api/species/lookup").param("scientificName", " ")).andExpect(status().isBadRequest());
    }

    @Test
    void speciesListsComeFromTheCatalog() throws Exception {
        mvc.perform(get("/api/species")).andExpect(jsonPath("$.length()").value(1));
        mvc.perform(get("/api/species/endangered"))
                .andExpect(jsonPath("$[0].scientificName").value("Eretmochelys imbricata"))
                .andExpect(jsonPath("$[0].category").value("fish"));
        mvc.perform(get("/api/species/invasive")).andExpect(jsonPath("$.length()").value(0));
    }
}
