package com.event.linking.api;

import com.event.linking.TestArticles;
import com.event.linking.core.model.ArticleRecord;
import com.event.linking.core.model.AssignmentOutcome;
import com.event.linking.core.model.Event;
import com.event.linking.lock.NoOpShardLock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties that hold whatever the input: idempotent ingestion, transitive duplicates,
 * single membership, monotonic date spans and deterministic severity.
 */
class LinkingInvariantsTest {

    private static final LocalDate MARCH_5 = LocalDate.of(2024, 3, 5);
    private static final Clock CLOCK = Clock.fixed(TestArticles.hoursAfterStart(48), ZoneOffset.UTC);

    private EventLinker linker;

    @BeforeEach
    void setUp() {
        linker = EventLinker.builder().clock(CLOCK).build();
    }

    @AfterEach
    void tearDown() {
        linker.close();
    }

    private static ArticleRecord teachersReport(String id, Instant publishedAt, int n) {
        return ArticleRecord.builder(TestArticles.teachersArticle(id, publishedAt, MARCH_5))
                .body("Report " + n + " on the teachers' stoppage in Thessaloniki.")
                .contentHash("content-" + n)
                .simHash(n * 0x0101010101010101L)
                .build();
    }

    private static ArticleRecord copyOf(ArticleRecord original, String id, Duration delay) {
        return ArticleRecord.builder(original)
                .id(id)
                .sourceUrl("https://mirror.example.gr/" + id)
                .canonicalUrl("https://mirror.example.gr/" + id)
                .publishedAt(original.getPublishedAt().plus(delay))
                .build();
    }

    /**
     * 10 seamen reports, 10 teachers reports and a syndicated copy of every other report.
     */
    private static List<ArticleRecord> mixedFeed(String prefix, int offset) {
        List<ArticleRecord> feed = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            ArticleRecord seamen = EventLinkerTest.report(prefix + "s" + i,
                    TestArticles.hoursAfterStart(i), MARCH_5, offset + i + 1);
            ArticleRecord teachers = teachersReport(prefix + "t" + i,
                    TestArticles.hoursAfterStart(i), offset + i + 11);
            feed.add(seamen);
            feed.add(teachers);
            if (i % 2 == 0) {
                feed.add(copyOf(seamen, prefix + "s" + i + "-copy", Duration.ofMinutes(30)));
                feed.add(copyOf(teachers, prefix + "t" + i + "-copy", Duration.ofMinutes(30)));
            }
        }
        return feed;
    }

    private void assertSingleMembership(List<ArticleRecord> articles) {
        List<Event> events = linker.getEvents();
        for (ArticleRecord article : articles) {
            long containing = events.stream().filter(e -> e.hasMember(article.getId())).count();
            boolean duplicate = linker.getAssignment(article.getId()).orElseThrow().isDuplicate();
            assertEquals(duplicate ? 0 : 1, containing, article.getId());
            assertTrue(linker.getEventForArticle(article.getId()).isPresent(), article.getId());
        }
    }

    @Test
    @DisplayName("Re-ingesting an article changes nothing")
    void reingestIsIdempotent() {
        ArticleRecord original = EventLinkerTest.report("a1", TestArticles.T0, MARCH_5, 1);
        ArticleRecord copy = copyOf(original, "a2", Duration.ofHours(1));
        IngestResult first = linker.ingest(original);
        linker.ingest(copy);
        long version = linker.getEventStore().version();
        int auditSize = linker.getAuditService().size();

        IngestResult again = linker.ingest(original);
        IngestResult copyAgain = linker.ingest(copy);

        assertTrue(again.isAlreadyProcessed());
        assertEquals(AssignmentOutcome.NEW_EVENT, again.getOutcome());
        assertEquals(first.getEventId(), again.getEventId());
        assertTrue(copyAgain.isAlreadyProcessed());
        assertTrue(copyAgain.isDuplicate());
        assertEquals(version, linker.getEventStore().version());
        assertEquals(auditSize, linker.getAuditService().size());
    }

    @Test
    @DisplayName("A copy of a copy resolves to the first original")
    void duplicatesAreTransitive() {
        ArticleRecord original = EventLinkerTest.report("a1", TestArticles.T0, MARCH_5, 1);
        ArticleRecord copy = copyOf(original, "a2", Duration.ofDays(1));
        // outside the window of the original, inside the window of the first copy
        ArticleRecord late = copyOf(original, "a3", Duration.ofHours(84));

        linker.ingest(original);
        linker.ingest(copy);
        IngestResult result = linker.ingest(late);

        assertTrue(result.isDuplicate());
        assertEquals("a1", result.getCanonicalArticleId());
        assertEquals("a1", linker.getDuplicateMapping().get("a3"));
        assertEquals(1, linker.getEvents().size());
    }

    @Test
    @DisplayName("Every original belongs to exactly one event")
    void singleMembership() {
        List<ArticleRecord> feed = mixedFeed("", 0);

        BatchResult result = linker.ingestBatch(feed);

        assertTrue(result.isSuccess(), () -> result.errors().toString());
        assertEquals(30, result.totalArticles());
        assertEquals(2, result.newEvents());
        assertEquals(18, result.joinedEvents());
        assertEquals(10, result.duplicates());
        assertEquals(2, linker.getEvents().size());
        linker.getEvents().forEach(event -> assertEquals(10, event.memberCount()));
        assertSingleMembership(feed);
    }

    @Test
    @DisplayName("Date spans only ever widen")
    void datesAreMonotonic() {
        List<ArticleRecord> reports = List.of(
                EventLinkerTest.report("a1", TestArticles.T0, MARCH_5, 1),
                EventLinkerTest.report("a2", TestArticles.hoursAfterStart(1), MARCH_5.minusDays(1), 2),
                EventLinkerTest.report("a3", TestArticles.hoursAfterStart(2), MARCH_5.plusDays(2), 3),
                EventLinkerTest.report("a4", TestArticles.hoursAfterStart(3), null, 4),
                EventLinkerTest.report("a5", TestArticles.hoursAfterStart(4), MARCH_5, 5));

        LocalDate start = null;
        LocalDate end = null;
        for (ArticleRecord report : reports) {
            Event event = linker.ingest(report).getEvent().orElseThrow();
            assertFalse(event.getStartDate().isAfter(event.getEndDate()));
            if (start != null) {
                assertFalse(event.getStartDate().isAfter(start), report.getId());
                assertFalse(event.getEndDate().isBefore(end), report.getId());
            }
            start = event.getStartDate();
            end = event.getEndDate();
        }

        assertEquals(1, linker.getEvents().size());
        assertEquals(MARCH_5.minusDays(1), start);
        assertEquals(MARCH_5.plusDays(2), end);
    }

    @Test
    @DisplayName("Severity does not depend on input order")
    void severityIsDeterministic() {
        List<ArticleRecord> feed = mixedFeed("", 0);
        List<ArticleRecord> shuffled = new ArrayList<>(feed);
        Collections.shuffle(shuffled, new Random(42));

        linker.ingestBatch(feed);
        // a single caller never contends for a shard
        try (EventLinker other = EventLinker.builder().clock(CLOCK).shardLock(new NoOpShardLock()).build()) {
            other.ingestBatch(shuffled);

            for (ArticleRecord article : List.of(feed.get(0), feed.get(1))) {
                Event mine = linker.getEventForArticle(article.getId()).orElseThrow();
                Event theirs = other.getEventForArticle(article.getId()).orElseThrow();
                assertEquals(mine.getSeverity(), theirs.getSeverity());
                assertEquals(mine.getConfidence(), theirs.getConfidence());
                assertEquals(mine.getMemberIds(), theirs.getMemberIds());
            }
        }
    }

    @Test
    @DisplayName("Concurrent batches over the same shards lose no article")
    void concurrentBatches() throws Exception {
        List<ArticleRecord> first = mixedFeed("x-", 0);
        List<ArticleRecord> second = mixedFeed("y-", 40);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<BatchResult> a = pool.submit(() -> linker.ingestBatch(first));
            Future<BatchResult> b = pool.submit(() -> linker.ingestBatch(second));
            assertTrue(a.get().isSuccess());
            assertTrue(b.get().isSuccess());
        } finally {
            pool.shutdownNow();
        }

        List<ArticleRecord> all = new ArrayList<>(first);
        all.addAll(second);
        assertEquals(2, linker.getEvents().size());
        linker.getEvents().forEach(event -> assertEquals(20, event.memberCount()));
        assertSingleMembership(all);
    }
}
