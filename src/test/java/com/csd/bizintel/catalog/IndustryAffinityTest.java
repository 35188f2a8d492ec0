package com.csd.bizintel.catalog;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IndustryAffinityTest {

    @Test
    void lookupIsCaseInsensitive() {
        assertEquals(0.9, IndustryAffinity.of("Technology", "TECHNOLOGY"), 1e-9);
        assertEquals(0.85, IndustryAffinity.of("finance", "Consulting"), 1e-9);
    }

    @Test
    void tableIsDirected() {
        assertEquals(0.9, IndustryAffinity.of("finance", "real-estate"), 1e-9);
        assertEquals(IndustryAffinity.UNKNOWN_PAIR, IndustryAffinity.of("real-estate", "finance"), 1e-9);
        assertEquals(0.8, IndustryAffinity.of("marketing", "retail"), 1e-9);
        assertEquals(IndustryAffinity.UNKNOWN_PAIR, IndustryAffinity.of("retail", "marketing"), 1e-9);
    }

    @Test
    void unknownOrMissingIndustriesAreNeutral() {
        assertEquals(0.5, IndustryAffinity.of(null, "finance"), 1e-9);
        assertEquals(0.5, IndustryAffinity.of("agriculture", "technology"), 1e-9);
        assertEquals(0.5, IndustryAffinity.of("technology", "agriculture"), 1e-9);
    }
}
