package org.example.ednascan.service.impl;

import lombok.RequiredArgsConstructor;
import org.example.ednascan.model.Sample;
import org.example.ednascan.model.SampleStatus;
import org.example.ednascan.repository.SampleRepository;
import org.example.ednascan.service.SpeciesService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class StartupTasks implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupTasks.class);

    private final SpeciesService speciesService;
    private final SampleRepository sampleRepository;
    private final SampleLockRegistry locks;
    private final Clock clock;

    @Value("${species.seed.enabled:true}")
    private boolean seedEnabled;

    @Override
    public void run(ApplicationArguments args) {
        if (seedEnabled) {
            speciesService.seedIfEmpty();
        }
        recoverInterrupted();
    }

    public int recoverInterrupted() {
        List<Sample> stuck = new ArrayList<>();
        Instant now = Instant.now(clock);
        for (Sample s : sampleRepository.findByStatusOrderByUploadedAtAsc(SampleStatus.PROCESSING)) {
            if (locks.isHeld(s.getId())) {
                continue;
            }
            s.transitionTo(SampleStatus.FAILED, now);
            stuck.add(s);
            log.warn("Sample {} was interrupted while processing; marked failed", s.getId());
        }
        sampleRepository.saveAll(stuck);
        return stuck.size();
    }
}
