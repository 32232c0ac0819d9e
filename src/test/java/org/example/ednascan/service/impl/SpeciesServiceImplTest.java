package org.example.ednascan.service.impl;

import org.example.ednascan.model.SpeciesCategory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SpeciesServiceImplTest {

    @Test
    void threatenedCategoriesCountAsEndangered() {
        assertTrue(SpeciesServiceImpl.isEndangeredStatus("CR"));
        assertTrue(SpeciesServiceImpl.isEndangeredStatus("en"));
        assertTrue(SpeciesServiceImpl.isEndangeredStatus(" VU "));
        assertTrue(SpeciesServiceImpl.isEndangeredStatus("NT"));
        assertFalse(SpeciesServiceImpl.isEndangeredStatus("LC"));
        assertFalse(SpeciesServiceImpl.isEndangeredStatus("DD"));
        assertFalse(SpeciesServiceImpl.isEndangeredStatus(null));
    }

    @Test
    void categoryGuessFallsBackToFish() {
        assertEquals(SpeciesCategory.CORAL, SpeciesServiceImpl.determineCategory("Anthozoa sp."));
        assertEquals(SpeciesCategory.ALGAE, SpeciesServiceImpl.determineCategory("Chlorophyta sp."));
        assertEquals(SpeciesCategory.FISH, SpeciesServiceImpl.determineCategory("Thunnus thynnus"));
    }
}
