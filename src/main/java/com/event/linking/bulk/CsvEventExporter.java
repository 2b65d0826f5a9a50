package com.event.linking.bulk;

import com.event.linking.core.model.Event;
import com.event.linking.core.model.EventMember;
import com.event.linking.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * CSV exporter for surviving events and their members.
 *
 * <p>Output format:</p>
 * <pre>
 * # EVENTS
 * id,key,sector,scope,eventType,locations,actors,startDate,endDate,state,severity,confidence,members,lastActivityAt
 * "ev-1","transport|gsee|athens|2024-02-12","transport","NATIONAL","STRIKE","athens","gsee",2024-02-12,2024-02-12,"OPEN",7.5000,0.8000,3,"2024-02-11T10:00:00Z"
 *
 * # MEMBERS
 * eventId,articleId,publishedAt,actionDate,lowConfidence
 * "ev-1","a-1","2024-02-10T09:30:00Z",2024-02-12,false
 * </pre>
 *
 * <p>Multi-valued columns are joined with {@code ;} in sorted order. Unknown values are empty.</p>
 */
public class CsvEventExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvEventExporter.class);

    private final EventStore eventStore;

    public CsvEventExporter(EventStore eventStore) {
        this.eventStore = eventStore;
    }

    public ExportResult exportEvents(OutputStream output, ProgressCallback callback) {
        return exportEvents(new OutputStreamWriter(output, StandardCharsets.UTF_8), callback);
    }

    public ExportResult exportEvents(Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));
        List<Event> events = eventStore.findSurviving();

        long totalEvents = 0;
        long totalMembers = 0;

        pw.println("# EVENTS");
        pw.println("id,key,sector,scope,eventType,locations,actors,startDate,endDate,state,severity,confidence,members,lastActivityAt");
        for (Event event : events) {
            pw.printf(Locale.ROOT, "%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%.4f,%.4f,%d,%s%n",
                    csvEscape(event.getId()),
                    csvEscape(event.getKey().value()),
                    csvEscape(event.getSector()),
                    csvEscape(event.getScope() != null ? event.getScope().name() : null),
                    csvEscape(event.getEventType() != null ? event.getEventType().name() : null),
                    csvEscape(String.join(";", new TreeSet<>(event.getLocations()))),
                    csvEscape(String.join(";", new TreeSet<>(event.getActors()))),
                    event.getStartDate() != null ? event.getStartDate() : "",
                    event.getEndDate() != null ? event.getEndDate() : "",
                    csvEscape(event.getState().name()),
                    event.getSeverity(),
                    event.getConfidence(),
                    event.memberCount(),
                    csvEscape(event.getLastActivityAt().toString()));
            totalEvents++;
        }
        cb.onProgress(totalEvents, events.size(), "Exported " + totalEvents + " events");

        pw.println();
        pw.println("# MEMBERS");
        pw.println("eventId,articleId,publishedAt,actionDate,lowConfidence");
        for (Event event : events) {
            for (EventMember member : event.getMembers()) {
                pw.printf(Locale.ROOT, "%s,%s,%s,%s,%s%n",
                        csvEscape(event.getId()),
                        csvEscape(member.articleId()),
                        csvEscape(member.publishedAt().toString()),
                        member.actionDate() != null ? member.actionDate() : "",
                        member.lowConfidence());
                totalMembers++;
            }
        }
        pw.flush();

        ExportResult result = new ExportResult(totalEvents, totalMembers);
        cb.onProgress(totalEvents, totalEvents, "Export completed");
        log.info("export.completed result={}", result);
        return result;
    }

    static String csvEscape(String value) {
        if (value == null || value.isEmpty()) return "";
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }
}
