package com.event.linking.analytics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes analytics snapshots as CSV rows or as JSON.
 */
public class AnalyticsExporter {

    static final String CSV_HEADER = "bucket,bucket_start,dimension,value,event_count,severity_index";

    private final ObjectMapper objectMapper;

    public AnalyticsExporter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public AnalyticsExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Writes one CSV line per {@link AnalyticsRow}, preceded by a header.
     *
     * @return number of data rows written
     */
    public int writeCsv(AnalyticsSnapshot snapshot, Writer writer) throws IOException {
        List<AnalyticsRow> rows = snapshot.toRows();
        writer.write(CSV_HEADER);
        writer.write('\n');
        for (AnalyticsRow row : rows) {
            writer.write(String.join(",",
                    escapeCsv(row.bucket()),
                    escapeCsv(row.bucketStart()),
                    escapeCsv(row.dimension()),
                    escapeCsv(row.value()),
                    String.valueOf(row.eventCount()),
                    String.valueOf(row.severityIndex())));
            writer.write('\n');
        }
        writer.flush();
        return rows.size();
    }

    public void writeJson(AnalyticsSnapshot snapshot, Writer writer) throws IOException {
        objectMapper.writeValue(writer, toJson(snapshot));
    }

    /**
     * JSON tree of the snapshot: granularity, store version, totals and nested buckets.
     */
    public ObjectNode toJson(AnalyticsSnapshot snapshot) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("granularity", snapshot.granularity().name());
        root.put("storeVersion", snapshot.storeVersion());
        root.put("totalEvents", snapshot.totalEvents());
        ArrayNode buckets = root.putArray("buckets");
        for (BucketSummary bucket : snapshot.buckets()) {
            ObjectNode node = buckets.addObject();
            node.put("bucket", bucket.label());
            node.put("bucketStart", bucket.bucketStart().toString());
            node.put("eventCount", bucket.eventCount());
            node.put("severityIndex", bucket.severityIndex());
            writeBreakdown(node.putArray("bySector"), bucket.bySector());
            writeBreakdown(node.putArray("byScope"), bucket.byScope());
            writeBreakdown(node.putArray("byEventType"), bucket.byEventType());
        }
        return root;
    }

    private static void writeBreakdown(ArrayNode array, List<BreakdownEntry> entries) {
        for (BreakdownEntry entry : entries) {
            ObjectNode node = array.addObject();
            node.put("value", entry.value());
            node.put("eventCount", entry.eventCount());
            node.put("severityIndex", entry.severityIndex());
        }
    }

    static String escapeCsv(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
