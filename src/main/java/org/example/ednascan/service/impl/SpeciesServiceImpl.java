package org.example.ednascan.service.impl;

import lombok.RequiredArgsConstructor;
import org.example.ednascan.dto.response.ExternalSpeciesRecord;
import org.example.ednascan.dto.response.SpeciesDistributionEntry;
import org.example.ednascan.model.Species;
import org.example.ednascan.model.SpeciesCategory;
import org.example.ednascan.repository.DetectionRepository;
import org.example.ednascan.repository.SpeciesRepository;
import org.example.ednascan.service.SpeciesLookupClient;
import org.example.ednascan.service.SpeciesService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class SpeciesServiceImpl implements SpeciesService {

    private static final Logger log = LoggerFactory.getLogger(SpeciesServiceImpl.class);

    static final Set<String> ENDANGERED_STATUSES = Set.of("CR", "EN", "VU", "NT");

    private final SpeciesRepository speciesRepository;
    private final DetectionRepository detectionRepository;
    private final SpeciesLookupClient lookupClient;
    private final SpeciesCatalogLoader catalogLoader;
    private final ResourceLoader resourceLoader;

    @Value("${species.seed.location:classpath:catalog/species.csv}")
    private String seedLocation;

    @Override
    @Transactional(readOnly = true)
    public List<Species> listAll() {
        return speciesRepository.findAll();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Species> listEndangered() {
        return speciesRepository.findByEndangeredTrue();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Species> listInvasive() {
        return speciesRepository.findByInvasiveTrue();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SpeciesDistributionEntry> getDistribution() {
        return detectionRepository.speciesDistribution();
    }

    @Override
    public Optional<Species> getSpeciesInfo(String scientificName) {
        if (scientificName == null || scientificName.isBlank()) {
            throw new IllegalArgumentException("scientificName is required");
        }
        String name = scientificName.trim();

        Optional<Species> local = speciesRepository.findByScientificName(name);
        if (local.isPresent()) {
            return local;
        }

        Optional<ExternalSpeciesRecord> remote = lookupClient.find(name);
        if (remote.isEmpty()) {
            return Optional.empty();
        }

        ExternalSpeciesRecord r = remote.get();
        Species s = new Species();
        s.setName(r.getScientificName());
        s.setScientificName(name);
        s.setCommonName(r.getCommonName());
        s.setCategory(determineCategory(name));
        s.setConservationStatus(r.getConservationStatus());
        s.setEndangered(isEndangeredStatus(r.getConservationStatus()));
        s.setInvasive(false);
        s.setDescription(r.getDescription());
        try {
            return Optional.of(speciesRepository.save(s));
        } catch (DataIntegrityViolationException e) {
            // inserted concurrently under the same scientific name
            return speciesRepository.findByScientificName(name);
        }
    }

    @Override
    @Transactional
    public int seedIfEmpty() {
        if (speciesRepository.count() > 0) {
            log.info("Species database already seeded");
            return 0;
        }
        Resource resource = resourceLoader.getResource(seedLocation);
        List<Species> species;
        try (Reader in = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            species = catalogLoader.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read species catalog " + seedLocation, e);
        }
        speciesRepository.saveAll(species);
        log.info("Seeded {} initial species from {}", species.size(), seedLocation);
        return species.size();
    }

    static boolean isEndangeredStatus(String status) {
        return status != null && ENDANGERED_STATUSES.contains(status.trim().toUpperCase(Locale.ROOT));
    }

    static SpeciesCategory determineCategory(String scientificName) {
        String n = scientificName.toLowerCase(Locale.ROOT);
        if (n.contains("coral") || n.contains("anthozoa")) return SpeciesCategory.CORAL;
        if (n.contains("algae") || n.contains("chlorophyta") || n.contains("phaeophyta")) return SpeciesCategory.ALGAE;
        if (n.contains("mollusc") || n.contains("arthropod") || n.contains("echinoderm")) return SpeciesCategory.INVERTEBRATE;
        return SpeciesCategory.FISH;
    }
}
