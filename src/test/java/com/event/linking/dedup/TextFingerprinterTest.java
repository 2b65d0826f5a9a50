package com.event.linking.dedup;

import com.event.linking.core.model.ArticleRecord;
import com.event.linking.rules.DefaultNormalizationRules;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextFingerprinterTest {

    private final TextFingerprinter fingerprinter = new TextFingerprinter(
            DefaultNormalizationRules.createDefaultEngine(), DuplicateDetectionConfig.defaults());

    private static ArticleRecord article(String title, String body) {
        return ArticleRecord.builder()
                .id("a")
                .title(title)
                .body(body)
                .publishedAt(Instant.parse("2024-03-01T08:00:00Z"))
                .build();
    }

    @Test
    void contentHashIgnoresCaseAccentsAndPunctuation() {
        Fingerprint a = fingerprinter.fingerprint(article("Απεργία στο λιμάνι", "Οι ναυτικοί, σήμερα, απεργούν."));
        Fingerprint b = fingerprinter.fingerprint(article("ΑΠΕΡΓΙΑ στο  λιμανι", "Οι ναυτικοι σημερα απεργουν"));

        assertEquals(a.contentHash(), b.contentHash());
        assertEquals(a.simHash(), b.simHash());
    }

    @Test
    void boilerplateLinesDoNotChangeHash() {
        String body = "Dock workers stopped work for 24 hours at the container terminal.";
        Fingerprint plain = fingerprinter.fingerprint(article("Dockers strike", body));
        Fingerprint withFooter = fingerprinter.fingerprint(article("Dockers strike",
                body + "\nRead more: https://news.example.gr/more\n© 2024 Example News. All rights reserved."));

        assertEquals(plain.contentHash(), withFooter.contentHash());
    }

    @Test
    void urlsAreRemovedInsideLines() {
        String stripped = fingerprinter.stripBoilerplate("Strike update https://example.gr/x today");
        assertFalse(stripped.contains("example"));
        assertTrue(stripped.contains("today"));
    }

    @Test
    void differentTextsHaveDifferentHashes() {
        Fingerprint a = fingerprinter.fingerprint(article("Dockers strike", "Port workers stop work"));
        Fingerprint b = fingerprinter.fingerprint(article("Teachers protest", "School staff march downtown"));

        assertNotEquals(a.contentHash(), b.contentHash());
    }

    @Test
    void emptyTextHasNoFingerprint() {
        assertTrue(fingerprinter.fingerprint(article(null, null)).isEmpty());
        assertTrue(fingerprinter.fingerprint(article("  ", "Read more: https://example.gr")).isEmpty());
    }

    @Test
    void shortTextIsOneShingle() {
        assertEquals(List.of("dockers strike"), fingerprinter.shingles(List.of("dockers", "strike")));
        assertEquals(List.of("a b c", "b c d"), fingerprinter.shingles(List.of("a", "b", "c", "d")));
    }

    @Test
    void hammingDistance() {
        assertEquals(0, TextFingerprinter.hammingDistance(42L, 42L));
        assertEquals(3, TextFingerprinter.hammingDistance(0L, 0b10101L));
        assertEquals(64, TextFingerprinter.hammingDistance(0L, -1L));
    }
}
