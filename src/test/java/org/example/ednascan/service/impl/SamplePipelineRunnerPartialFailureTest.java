package org.example.ednascan.service.impl;

import org.example.ednascan.dto.event.PipelineEvent;
import org.example.ednascan.model.Sample;
import org.example.ednascan.model.SampleStatus;
import org.example.ednascan.model.SpeciesCategory;
import org.example.ednascan.repository.AlertRepository;
import org.example.ednascan.repository.DetectionRepository;
import org.example.ednascan.repository.SampleRepository;
import org.example.ednascan.repository.SpeciesRepository;
import org.example.ednascan.support.RecordingBroadcaster;
import org.example.ednascan.support.TestData;
import org.example.ednascan.support.TestPipelineConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Import;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doCallRealMethod;

@SpringBootTest
@Import(TestPipelineConfig.class)
class SamplePipelineRunnerPartialFailureTest {

    @Autowired SamplePipelineRunner runner;
    @Autowired SampleRepository sampleRepository;
    @Autowired SpeciesRepository speciesRepository;
    @Autowired DetectionRepository detectionRepository;
    @Autowired AlertRepository alertRepository;
    @Autowired RecordingBroadcaster broadcaster;

    @SpyBean AlertEvaluator alertEvaluator;

    @TempDir
    Path uploads;

    @BeforeEach
    void setUp() {
        alertRepository.deleteAll();
        detectionRepository.deleteAll();
        sampleRepository.deleteAll();
        speciesRepository.deleteAll();
        broadcaster.clear();
        speciesRepository.save(TestData.species("Eretmochelys imbricata", SpeciesCategory.FISH, true, false));
    }

    @Test
    void failureOnSecondRecordKeepsEarlierWritesAndFailsTheSample() throws Exception {
        doCallRealMethod()
                .doThrow(new RuntimeException("boom"))
                .when(alertEvaluator).evaluate(any(), any(), any());

        Sample sample = sampleRepository.save(TestData.sample("reads.fasta", ".fasta", SampleStatus.UPLOADED));
        String twoRecords = TestData.FISH_RECORD + TestData.FISH_RECORD.replace("amplicon_1", "amplicon_3");
        Path upload = Files.writeString(uploads.resolve("reads.fasta"), twoRecords);

        assertEquals(SampleStatus.FAILED, runner.process(sample.getId(), upload, "reads.fasta"));

        Sample stored = sampleRepository.findById(sample.getId()).orElseThrow();
        assertEquals(SampleStatus.FAILED, stored.getStatus());
        assertNotNull(stored.getProcessedAt());
        assertEquals(2, detectionRepository.countBySampleId(sample.getId()));
        assertEquals(1, alertRepository.count());

        List<PipelineEvent> events = broadcaster.eventsFor(sample.getId());
        assertEquals(1, events.size());
        assertEquals(PipelineEvent.SAMPLE_ERROR, events.get(0).getType());
        assertEquals("boom", events.get(0).getData().get("error"));
        assertTrue(Files.exists(upload));
    }
}
