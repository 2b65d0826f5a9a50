package com.event.linking.bulk;

import com.event.linking.api.BatchResult;
import com.event.linking.api.EventLinker;
import com.event.linking.core.model.ArticleRecord;
import com.event.linking.core.model.AttributeBundle;
import com.event.linking.core.model.EventType;
import com.event.linking.core.model.Scope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Imports article files written by the news scraper.
 *
 * <p>Input is either a JSON array or JSON Lines, one article object per record:</p>
 * <pre>
 * {"url": "https://www.902.gr/eidisi/ergatiko/123",
 *  "title": "48ωρη απεργία στα λιμάνια",
 *  "published_at": "2024-02-10T09:30",
 *  "tags": ["ΛΙΜΑΝΙΑ"],
 *  "body": "...",
 *  "attributes": {
 *     "sector": "maritime",
 *     "scope": {"value": "national", "confidence": 0.8},
 *     "location": "Piraeus",
 *     "action_date": "2024-02-12",
 *     "actors": ["PENEN", {"value": "PNO", "confidence": 0.9}],
 *     "event_type": "strike"}}
 * </pre>
 *
 * <p>The article id is {@code id} when present, otherwise the url. Timestamps without an offset
 * are read in the source time zone. Attribute values are plain or {@code {value, confidence}};
 * plain values are taken as certain. Records that fail to parse are reported and skipped.</p>
 */
public class JsonArticleImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonArticleImporter.class);

    public static final ZoneId DEFAULT_SOURCE_ZONE = ZoneId.of("Europe/Athens");

    private final EventLinker linker;
    private final ObjectMapper objectMapper;
    private final ZoneId sourceZone;

    public JsonArticleImporter(EventLinker linker) {
        this(linker, new ObjectMapper(), DEFAULT_SOURCE_ZONE);
    }

    public JsonArticleImporter(EventLinker linker, ObjectMapper objectMapper, ZoneId sourceZone) {
        this.linker = linker;
        this.objectMapper = objectMapper;
        this.sourceZone = sourceZone;
    }

    public ImportResult importArticles(InputStream input, ProgressCallback callback) {
        return importArticles(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    /**
     * Parses the input and ingests the articles in publication order, in batches no larger than
     * the linker's maximum batch size.
     */
    public ImportResult importArticles(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        ParsedArticles parsed = parse(reader);
        List<ImportResult.ImportError> errors = new ArrayList<>(parsed.errors());

        List<ArticleRecord> ordered = new ArrayList<>(parsed.articles());
        ordered.sort(Comparator.comparing(ArticleRecord::getPublishedAt).thenComparing(ArticleRecord::getId));

        long newEvents = 0;
        long joined = 0;
        long duplicates = 0;
        long repeated = 0;
        long processed = 0;
        int batchSize = linker.getOptions().getMaxBatchSize();
        for (int from = 0; from < ordered.size(); from += batchSize) {
            List<ArticleRecord> chunk = ordered.subList(from, Math.min(from + batchSize, ordered.size()));
            BatchResult batch = linker.ingestBatch(chunk);
            newEvents += batch.newEvents();
            joined += batch.joinedEvents();
            duplicates += batch.duplicates();
            repeated += batch.alreadyProcessed();
            batch.errors().forEach(message -> errors.add(new ImportResult.ImportError(0, "", message)));
            processed += chunk.size();
            cb.onProgress(processed, ordered.size(), "Ingested " + processed + " articles");
        }

        ImportResult result = new ImportResult(parsed.totalRecords(), newEvents, joined, duplicates, repeated, errors);
        cb.onProgress(processed, ordered.size(), "Import completed");
        log.info("import.completed result={}", result);
        return result;
    }

    /**
     * Parses a JSON array or JSON Lines input without ingesting anything.
     */
    public ParsedArticles parse(Reader reader) {
        List<ArticleRecord> articles = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();
        long records = 0;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            int first = skipWhitespace(br);
            if (first == '[') {
                JsonNode array = objectMapper.readTree(br);
                for (JsonNode node : array) {
                    records++;
                    readRecord(node, records, articles, errors);
                }
            } else {
                String line;
                while ((line = br.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    records++;
                    try {
                        readRecord(objectMapper.readTree(line), records, articles, errors);
                    } catch (JsonProcessingException e) {
                        errors.add(new ImportResult.ImportError(records, "", "Malformed JSON: " + e.getOriginalMessage()));
                        log.warn("import.malformed record={} error={}", records, e.getOriginalMessage());
                    }
                }
            }
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            errors.add(new ImportResult.ImportError(0, "", "IO error: " + e.getMessage()));
        }
        return new ParsedArticles(articles, errors, records);
    }

    /**
     * Advances past leading whitespace and returns the next character without consuming it.
     */
    private static int skipWhitespace(BufferedReader br) throws IOException {
        int c;
        while (true) {
            br.mark(1);
            c = br.read();
            if (c == -1 || !Character.isWhitespace(c)) {
                break;
            }
        }
        br.reset();
        return c;
    }

    private void readRecord(JsonNode node, long recordNumber, List<ArticleRecord> articles,
                            List<ImportResult.ImportError> errors) {
        String reference = text(node, "id").or(() -> text(node, "url")).orElse("");
        try {
            articles.add(toArticle(node));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            errors.add(new ImportResult.ImportError(recordNumber, reference, e.getMessage()));
            log.warn("import.error record={} reference='{}' error={}", recordNumber, reference, e.getMessage());
        }
    }

    ArticleRecord toArticle(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Record is not a JSON object");
        }
        String id = text(node, "id").or(() -> text(node, "url"))
                .orElseThrow(() -> new IllegalArgumentException("Record has neither id nor url"));
        String published = text(node, "published_at")
                .orElseThrow(() -> new IllegalArgumentException("Record " + id + " has no published_at"));

        List<String> tags = new ArrayList<>();
        node.path("tags").forEach(tag -> {
            if (tag.isTextual() && !tag.asText().isBlank()) {
                tags.add(tag.asText());
            }
        });

        return ArticleRecord.builder()
                .id(id)
                .sourceUrl(text(node, "url").orElse(null))
                .canonicalUrl(text(node, "canonical_url").orElse(null))
                .title(text(node, "title").orElse(null))
                .summary(text(node, "summary").orElse(null))
                .body(text(node, "body").orElse(null))
                .tags(tags)
                .contentHash(text(node, "content_hash").orElse(null))
                .simHash(node.path("simhash").isIntegralNumber() ? node.path("simhash").asLong() : null)
                .publishedAt(parseInstant(published))
                .attributes(toAttributes(node.path("attributes")))
                .build();
    }

    AttributeBundle toAttributes(JsonNode attributes) {
        AttributeBundle.Builder builder = AttributeBundle.builder();
        if (!attributes.isObject()) {
            return builder.build();
        }
        attribute(attributes.path("sector"), Optional::of)
                .ifPresent(a -> builder.sector(a.value(), a.confidence()));
        attribute(attributes.path("scope"), Scope::fromLabel)
                .ifPresent(a -> builder.scope(a.value(), a.confidence()));
        attribute(attributes.path("location"), Optional::of)
                .ifPresent(a -> builder.location(a.value(), a.confidence()));
        attribute(attributes.path("action_date"), value -> Optional.of(LocalDate.parse(value)))
                .ifPresent(a -> builder.actionDate(a.value(), a.confidence()));
        attribute(attributes.path("event_type"), EventType::fromLabel)
                .ifPresent(a -> builder.eventType(a.value(), a.confidence()));
        attribute(attributes.path("primary_actor"), Optional::of)
                .ifPresent(a -> builder.actor(a.value(), a.confidence()));
        for (JsonNode actor : attributes.path("actors")) {
            attribute(actor, Optional::of).ifPresent(a -> builder.actor(a.value(), a.confidence()));
        }
        return builder.build();
    }

    /**
     * Reads a plain or {@code {value, confidence}} attribute. Blank and unparseable labels are absent.
     */
    private static <T> Optional<Valued<T>> attribute(JsonNode node, Function<String, Optional<T>> parser) {
        JsonNode valueNode = node.isObject() ? node.path("value") : node;
        if (!valueNode.isValueNode() || valueNode.isNull() || valueNode.asText().isBlank()) {
            return Optional.empty();
        }
        double confidence = node.isObject() && node.path("confidence").isNumber()
                ? node.path("confidence").asDouble() : 1.0;
        return parser.apply(valueNode.asText().trim()).map(value -> new Valued<>(value, confidence));
    }

    /**
     * Parses an ISO instant, an offset date-time, or a local date-time in the source zone.
     */
    Instant parseInstant(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(value).atZone(sourceZone).toInstant();
        }
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || value.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.asText().trim());
    }

    private record Valued<T>(T value, double confidence) {
    }

    /**
     * Articles parsed from an input, with the records that failed.
     */
    public record ParsedArticles(List<ArticleRecord> articles, List<ImportResult.ImportError> errors,
                                 long totalRecords) {
        public ParsedArticles {
            articles = List.copyOf(articles);
            errors = List.copyOf(errors);
        }
    }
}
