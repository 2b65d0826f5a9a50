package com.event.linking.bulk;

import com.event.linking.TestArticles;
import com.event.linking.api.EventLinker;
import com.event.linking.api.LinkingOptions;
import com.event.linking.core.model.ArticleRecord;
import com.event.linking.core.model.AttributeBundle;
import com.event.linking.core.model.EventType;
import com.event.linking.core.model.Scope;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonArticleImporterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-02-11T12:00:00Z"), ZoneOffset.UTC);

    private EventLinker linker;
    private JsonArticleImporter importer;

    @BeforeEach
    void setUp() {
        linker = EventLinker.builder().clock(CLOCK).build();
        importer = new JsonArticleImporter(linker);
    }

    @AfterEach
    void tearDown() {
        linker.close();
    }

    private static String seamenRecord(String url, String publishedAt) {
        return "{\"url\": \"" + url + "\", "
                + "\"title\": \"" + TestArticles.SEAMEN_TITLE + "\", "
                + "\"body\": \"" + TestArticles.SEAMEN_BODY + "\", "
                + "\"published_at\": \"" + publishedAt + "\", "
                + "\"attributes\": {\"sector\": \"maritime\", \"location\": \"Πειραιάς\", "
                + "\"action_date\": \"2024-02-13\", \"event_type\": \"strike\"}}";
    }

    private static String teachersRecord(String url, String publishedAt) {
        return "{\"url\": \"" + url + "\", "
                + "\"title\": \"" + TestArticles.TEACHERS_TITLE + "\", "
                + "\"body\": \"" + TestArticles.TEACHERS_BODY + "\", "
                + "\"published_at\": \"" + publishedAt + "\", "
                + "\"attributes\": {\"sector\": \"education\", \"location\": \"Θεσσαλονίκη\"}}";
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        void parsesJsonLines() {
            String input = seamenRecord("https://a.gr/1", "2024-02-10T09:30:00Z") + "\n\n"
                    + teachersRecord("https://a.gr/2", "2024-02-10T10:00:00Z") + "\n";

            JsonArticleImporter.ParsedArticles parsed = importer.parse(new StringReader(input));

            assertEquals(2, parsed.totalRecords());
            assertEquals(2, parsed.articles().size());
            assertTrue(parsed.errors().isEmpty());
        }

        @Test
        void parsesJsonArrayWithLeadingWhitespace() {
            String input = "  \n[" + seamenRecord("https://a.gr/1", "2024-02-10T09:30:00Z") + ",\n"
                    + teachersRecord("https://a.gr/2", "2024-02-10T10:00:00Z") + "]";

            JsonArticleImporter.ParsedArticles parsed = importer.parse(new StringReader(input));

            assertEquals(2, parsed.totalRecords());
            assertEquals(List.of("https://a.gr/1", "https://a.gr/2"),
                    parsed.articles().stream().map(ArticleRecord::getId).toList());
        }

        @Test
        void idFallsBackToUrl() {
            String withId = "{\"id\": \"art-7\", \"url\": \"https://a.gr/7\", \"published_at\": \"2024-02-10T09:30:00Z\"}";
            String withoutId = "{\"url\": \"https://a.gr/8\", \"published_at\": \"2024-02-10T09:30:00Z\"}";

            List<ArticleRecord> articles = importer.parse(new StringReader(withId + "\n" + withoutId)).articles();

            assertEquals("art-7", articles.get(0).getId());
            assertEquals("https://a.gr/7", articles.get(0).getSourceUrl());
            assertEquals("https://a.gr/8", articles.get(1).getId());
        }

        @Test
        @DisplayName("Local timestamps are read in Athens time")
        void localTimestampsUseSourceZone() {
            assertEquals(Instant.parse("2024-02-10T07:30:00Z"), importer.parseInstant("2024-02-10T09:30"));
            assertEquals(Instant.parse("2024-07-10T06:30:00Z"), importer.parseInstant("2024-07-10T09:30"));
            assertEquals(Instant.parse("2024-02-10T09:30:00Z"), importer.parseInstant("2024-02-10T09:30:00Z"));
            assertEquals(Instant.parse("2024-02-10T08:30:00Z"), importer.parseInstant("2024-02-10T09:30:00+01:00"));
        }

        @Test
        void readsPlainAndWeightedAttributes() throws Exception {
            String json = "{\"sector\": \"maritime\", "
                    + "\"scope\": {\"value\": \"national\", \"confidence\": 0.8}, "
                    + "\"location\": \"  \", "
                    + "\"action_date\": \"2024-02-12\", "
                    + "\"event_type\": \"work stoppage\", "
                    + "\"actors\": [\"PENEN\", {\"value\": \"PNO\", \"confidence\": 0.9}]}";

            AttributeBundle attributes = importer.toAttributes(new ObjectMapper().readTree(json));

            assertEquals("maritime", attributes.getSector().value());
            assertEquals(1.0, attributes.getSector().confidence());
            assertEquals(Scope.NATIONAL, attributes.getScope().value());
            assertEquals(0.8, attributes.getScope().confidence());
            assertFalse(attributes.getLocation().isPresent());
            assertEquals(LocalDate.of(2024, 2, 12), attributes.getActionDate().value());
            assertEquals(EventType.WORK_STOPPAGE, attributes.getEventType().value());
            assertEquals(2, attributes.getActors().size());
            assertEquals("PENEN", attributes.primaryActor().orElseThrow());
        }

        @Test
        void unknownScopeLabelIsAbsent() throws Exception {
            AttributeBundle attributes = importer.toAttributes(
                    new ObjectMapper().readTree("{\"scope\": \"galactic\", \"event_type\": \"sit-in\"}"));

            assertFalse(attributes.getScope().isPresent());
            assertEquals(EventType.OTHER, attributes.getEventType().value());
        }

        @Test
        void badRecordsAreReportedAndSkipped() {
            String input = "{not json}\n"
                    + "{\"title\": \"no id\", \"published_at\": \"2024-02-10T09:30:00Z\"}\n"
                    + "{\"url\": \"https://a.gr/3\"}\n"
                    + "{\"url\": \"https://a.gr/4\", \"published_at\": \"2024-02-10T09:30:00Z\", "
                    + "\"attributes\": {\"action_date\": \"2024-13-45\"}}\n"
                    + seamenRecord("https://a.gr/5", "2024-02-10T09:30:00Z") + "\n";

            JsonArticleImporter.ParsedArticles parsed = importer.parse(new StringReader(input));

            assertEquals(5, parsed.totalRecords());
            assertEquals(1, parsed.articles().size());
            assertEquals(4, parsed.errors().size());
            assertEquals(1, parsed.errors().get(0).recordNumber());
            assertTrue(parsed.errors().get(0).message().startsWith("Malformed JSON"));
            assertEquals("https://a.gr/3", parsed.errors().get(2).reference());
            assertEquals(4, parsed.errors().get(3).recordNumber());
        }
    }

    @Nested
    @DisplayName("Import")
    class Import {

        @Test
        void ingestsInPublicationOrderAndCountsOutcomes() {
            String input = seamenRecord("https://b.gr/copy", "2024-02-10T11:00:00Z") + "\n"
                    + seamenRecord("https://a.gr/original", "2024-02-10T09:30:00Z") + "\n"
                    + teachersRecord("https://a.gr/teachers", "2024-02-10T10:00:00Z") + "\n"
                    + "{broken\n";

            ImportResult result = importer.importArticles(
                    new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), null);

            assertEquals(4, result.totalRecords());
            assertEquals(2, result.newEvents());
            assertEquals(1, result.duplicates());
            assertEquals(0, result.joinedEvents());
            assertEquals(3, result.successCount());
            assertEquals(1, result.errorCount());
            assertEquals("https://a.gr/original",
                    linker.getDuplicateMapping().get("https://b.gr/copy"));
        }

        @Test
        void reimportReportsAlreadyProcessed() {
            String input = seamenRecord("https://a.gr/1", "2024-02-10T09:30:00Z");
            importer.importArticles(new StringReader(input), null);

            ImportResult again = importer.importArticles(new StringReader(input), null);

            assertEquals(1, again.alreadyProcessed());
            assertEquals(0, again.newEvents());
            assertEquals(1, linker.getEvents().size());
        }

        @Test
        void splitsIntoBatchesAndReportsProgress() {
            linker.close();
            linker = EventLinker.builder()
                    .clock(CLOCK)
                    .options(LinkingOptions.builder().maxBatchSize(1).build())
                    .build();
            importer = new JsonArticleImporter(linker);
            String input = seamenRecord("https://a.gr/1", "2024-02-10T09:30:00Z") + "\n"
                    + teachersRecord("https://a.gr/2", "2024-02-10T10:00:00Z");
            List<String> messages = new ArrayList<>();

            ImportResult result = importer.importArticles(new StringReader(input),
                    (processed, total, message) -> messages.add(processed + "/" + total + " " + message));

            assertEquals(2, result.newEvents());
            assertEquals(List.of("1/2 Ingested 1 articles", "2/2 Ingested 2 articles", "2/2 Import completed"),
                    messages);
        }
    }
}
