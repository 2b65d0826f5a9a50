package com.event.linking.dedup;

import com.event.linking.TestArticles;
import com.event.linking.core.model.ArticleRecord;
import com.event.linking.dedup.DuplicateCheckResult.MatchKind;
import com.event.linking.rules.DefaultNormalizationRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NearDuplicateDetectorTest {

    private static final long BASE_HASH = 0x0F0F_0F0F_0F0F_0F0FL;

    private NearDuplicateDetector detector;

    @BeforeEach
    void setUp() {
        DuplicateDetectionConfig config = DuplicateDetectionConfig.defaults();
        detector = new NearDuplicateDetector(
                new TextFingerprinter(DefaultNormalizationRules.createDefaultEngine(), config), config);
    }

    private static ArticleRecord text(String id, String body, Instant publishedAt) {
        return ArticleRecord.builder()
                .id(id)
                .sourceUrl("https://site-" + id + ".gr/article")
                .title("Seamen strike")
                .body(body)
                .publishedAt(publishedAt)
                .build();
    }

    private static ArticleRecord hashed(String id, long simHash) {
        return ArticleRecord.builder()
                .id(id)
                .sourceUrl("https://site-" + id + ".gr/article")
                .body("distinct text " + id)
                .contentHash("hash-" + id)
                .simHash(simHash)
                .publishedAt(TestArticles.T0)
                .build();
    }

    @Nested
    @DisplayName("Exact matches")
    class Exact {

        @Test
        @DisplayName("Syndicated copy on another site is a content-hash duplicate")
        void syndicatedCopy() {
            detector.checkAndRegister(text("a", TestArticles.SEAMEN_BODY, TestArticles.T0));
            DuplicateCheckResult result = detector.checkAndRegister(
                    text("b", TestArticles.SEAMEN_BODY.toUpperCase() + "\nRead more: https://x.gr", TestArticles.T0.plusSeconds(600)));

            assertTrue(result.duplicate());
            assertEquals(MatchKind.CONTENT_HASH, result.matchKind());
            assertEquals("a", result.canonicalArticleId());
            assertEquals(0, result.hammingDistance());
        }

        @Test
        void sameCanonicalUrl() {
            detector.checkAndRegister(ArticleRecord.builder().id("a").sourceUrl("https://x.gr/1?utm=rss")
                    .canonicalUrl("https://x.gr/1").body("first text").publishedAt(TestArticles.T0).build());
            DuplicateCheckResult result = detector.checkAndRegister(ArticleRecord.builder().id("b")
                    .sourceUrl("https://x.gr/1").body("edited text").publishedAt(TestArticles.T0).build());

            assertTrue(result.duplicate());
            assertEquals(MatchKind.CANONICAL_URL, result.matchKind());
        }

        @Test
        @DisplayName("Copies outside the time window are not duplicates")
        void outsideWindow() {
            detector.checkAndRegister(text("a", TestArticles.SEAMEN_BODY, TestArticles.T0));
            DuplicateCheckResult result = detector.checkAndRegister(
                    text("b", TestArticles.SEAMEN_BODY, TestArticles.T0.plus(Duration.ofDays(4))));

            assertFalse(result.duplicate());
            assertEquals(MatchKind.NONE, result.matchKind());
        }
    }

    @Nested
    @DisplayName("SimHash matches")
    class Near {

        @Test
        void withinHammingDistance() {
            detector.checkAndRegister(hashed("a", BASE_HASH));
            DuplicateCheckResult result = detector.checkAndRegister(hashed("b", BASE_HASH ^ 0b111L));

            assertTrue(result.duplicate());
            assertEquals(MatchKind.SIMHASH, result.matchKind());
            assertEquals(3, result.hammingDistance());
        }

        @Test
        void beyondHammingDistance() {
            detector.checkAndRegister(hashed("a", BASE_HASH));
            DuplicateCheckResult result = detector.checkAndRegister(hashed("b", BASE_HASH ^ 0b1111L));

            assertFalse(result.duplicate());
        }

        @Test
        @DisplayName("Duplicate of a duplicate resolves to the first canonical article")
        void transitive() {
            detector.checkAndRegister(hashed("a", BASE_HASH));
            detector.checkAndRegister(hashed("b", BASE_HASH ^ 0b11L));
            DuplicateCheckResult c = detector.checkAndRegister(hashed("c", BASE_HASH ^ 0b1111L));

            assertTrue(c.duplicate());
            assertEquals("b", c.matchedArticleId());
            assertEquals("a", c.canonicalArticleId());
            assertEquals(Map.of("b", "a", "c", "a"), detector.duplicateMapping());
        }

        @Test
        void closestCandidateWins() {
            detector.checkAndRegister(hashed("a", BASE_HASH ^ 0b11L));
            detector.checkAndRegister(hashed("b", BASE_HASH ^ 0b11_0000_0000L));
            DuplicateCheckResult result = detector.check(hashed("c", BASE_HASH ^ 0b1L));

            assertEquals("a", result.matchedArticleId());
            assertEquals(1, result.hammingDistance());
        }
    }

    @Test
    @DisplayName("Articles without text are originals")
    void emptyText() {
        ArticleRecord first = ArticleRecord.builder().id("a").publishedAt(TestArticles.T0).build();
        ArticleRecord second = ArticleRecord.builder().id("b").publishedAt(TestArticles.T0).build();

        assertFalse(detector.checkAndRegister(first).duplicate());
        DuplicateCheckResult result = detector.checkAndRegister(second);

        assertFalse(result.duplicate());
        assertTrue(result.fingerprint().isEmpty());
    }

    @Test
    @DisplayName("Articles without text never match by URL")
    void emptyTextSkipsUrlMatch() {
        String url = "https://news.example.gr/live-blog";
        ArticleRecord placeholder = ArticleRecord.builder().id("a").sourceUrl(url).publishedAt(TestArticles.T0).build();
        ArticleRecord secondPlaceholder = ArticleRecord.builder().id("b").sourceUrl(url)
                .publishedAt(TestArticles.T0.plusSeconds(60)).build();
        ArticleRecord full = ArticleRecord.builder(text("c", TestArticles.SEAMEN_BODY, TestArticles.T0.plusSeconds(120)))
                .sourceUrl(url)
                .canonicalUrl(url)
                .build();

        detector.checkAndRegister(placeholder);

        assertFalse(detector.checkAndRegister(secondPlaceholder).duplicate());
        assertFalse(detector.checkAndRegister(full).duplicate());
        assertTrue(detector.duplicateMapping().isEmpty());
    }

    @Test
    void checkDoesNotRegister() {
        detector.check(text("a", TestArticles.SEAMEN_BODY, TestArticles.T0));

        assertEquals(0, detector.indexedCount());
        assertTrue(detector.canonicalOf("a").isEmpty());
    }

    @Test
    void registeringTwiceFails() {
        ArticleRecord article = text("a", TestArticles.SEAMEN_BODY, TestArticles.T0);
        detector.checkAndRegister(article);

        assertThrows(IllegalStateException.class, () -> detector.checkAndRegister(article));
    }

    @Test
    @DisplayName("Unregister rolls back a registration")
    void unregister() {
        detector.checkAndRegister(text("a", TestArticles.SEAMEN_BODY, TestArticles.T0));
        detector.checkAndRegister(text("b", TestArticles.SEAMEN_BODY, TestArticles.T0));

        detector.unregister("b");

        assertEquals(1, detector.indexedCount());
        assertTrue(detector.duplicateMapping().isEmpty());
        assertTrue(detector.checkAndRegister(text("b", TestArticles.SEAMEN_BODY, TestArticles.T0)).duplicate());
    }
}
