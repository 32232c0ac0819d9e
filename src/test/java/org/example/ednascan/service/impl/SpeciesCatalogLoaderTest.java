package org.example.ednascan.service.impl;

import org.example.ednascan.model.Species;
import org.example.ednascan.model.SpeciesCategory;
import org.junit.jupiter.api.Test;

import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpeciesCatalogLoaderTest {

    private static final String HEADER =
            "name,scientificName,commonName,category,conservationStatus,endangered,invasive,description\n";

    private final SpeciesCatalogLoader loader = new SpeciesCatalogLoader();

    @Test
    void readsRowsWithQuotedFields() throws Exception {
        String csv = HEADER
                + "Lionfish,Pterois volitans,Red lionfish,fish,lc,false,true,\"Venomous, fast spreading\"\n";

        List<Species> species = loader.load(new StringReader(csv));

        assertEquals(1, species.size());
        Species s = species.get(0);
        assertEquals("Pterois volitans", s.getScientificName());
        assertEquals(SpeciesCategory.FISH, s.getCategory());
        assertEquals("LC", s.getConservationStatus());
        assertTrue(s.isInvasive());
        assertFalse(s.isEndangered());
        assertEquals("Venomous, fast spreading", s.getDescription());
    }

    @Test
    void duplicateScientificNameIsRejected() {
        String csv = HEADER
                + "A,Acropora cervicornis,,coral,CR,true,false,\n"
                + "B,Acropora cervicornis,,coral,CR,true,false,\n";

        assertThrows(IllegalArgumentException.class, () -> loader.load(new StringReader(csv)));
    }

    @Test
    void missingScientificNameIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(new StringReader(HEADER + "A,,,fish,LC,false,false,\n")));
    }

    @Test
    void bundledCatalogLoads() throws Exception {
        try (Reader in = new InputStreamReader(
                getClass().getResourceAsStream("/catalog/species.csv"), StandardCharsets.UTF_8)) {
            List<Species> species = loader.load(in);
            assertEquals(5, species.size());
            assertTrue(species.stream().anyMatch(Species::isEndangered));
            assertTrue(species.stream().anyMatch(Species::isInvasive));
        }
    }
}
