package org.tanzu.ruckusmcp.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegionTest {

    @Test
    void resolvesKnownCodesIgnoringCaseAndWhitespace() {
        assertEquals(Region.NA, Region.resolve("na"));
        assertEquals(Region.EU, Region.resolve(" EU "));
        assertEquals(Region.ASIA, Region.resolve("Asia"));
    }

    @Test
    void unknownNullOrBlankFallBackToNorthAmerica() {
        assertEquals(Region.NA, Region.resolve("apac"));
        assertEquals(Region.NA, Region.resolve(null));
        assertEquals(Region.NA, Region.resolve(""));
    }

    @Test
    void baseUrlUsesHttps() {
        assertEquals("https://api.asia.ruckus.cloud", Region.ASIA.baseUrl());
    }
}
