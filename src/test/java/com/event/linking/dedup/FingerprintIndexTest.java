package com.event.linking.dedup;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintIndexTest {

    private static final Instant NOW = Instant.parse("2024-03-01T08:00:00Z");

    @Test
    void nearCandidatesShareABand() {
        FingerprintIndex index = new FingerprintIndex(4);
        index.add(new IndexedArticle("a", null, "h1", 0x0000_0000_0000_0000L, NOW));
        index.add(new IndexedArticle("b", null, "h2", 0xFFFF_FFFF_FFFF_FFFFL, NOW));

        // Differs from "a" only in the lowest band
        assertEquals("a", index.nearCandidates(0x0000_0000_0000_00FFL).get(0).articleId());
        assertEquals(1, index.nearCandidates(0x0000_0000_0000_00FFL).size());
        assertTrue(index.nearCandidates(0x0F0F_0F0F_0F0F_0F0FL).isEmpty());
    }

    @Test
    void removeClearsEveryStructure() {
        FingerprintIndex index = new FingerprintIndex(4);
        index.add(new IndexedArticle("a", "https://x.gr/1", "h1", 7L, NOW));

        assertTrue(index.remove("a"));
        assertFalse(index.remove("a"));
        assertTrue(index.byCanonicalUrl("https://x.gr/1").isEmpty());
        assertTrue(index.byContentHash("h1").isEmpty());
        assertTrue(index.nearCandidates(7L).isEmpty());
        assertEquals(0, index.size());
    }

    @Test
    void rejectsDoubleAdd() {
        FingerprintIndex index = new FingerprintIndex(4);
        index.add(new IndexedArticle("a", null, null, null, NOW));

        assertThrows(IllegalStateException.class, () -> index.add(new IndexedArticle("a", null, null, null, NOW)));
    }

    @Test
    void bandsMustDivideHashWidth() {
        assertThrows(IllegalArgumentException.class, () -> new FingerprintIndex(5));
    }

    @Test
    void bandValueExtractsBits() {
        FingerprintIndex index = new FingerprintIndex(4);
        long hash = 0x1111_2222_3333_4444L;

        assertEquals(0x4444L, index.bandValue(hash, 0));
        assertEquals(0x1111L, index.bandValue(hash, 3));
    }
}
