package com.event.linking.audit;

import com.event.linking.core.model.MergeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only ledger of reconciliation merges with their provenance.
 */
public class MergeLedger {
    private static final Logger log = LoggerFactory.getLogger(MergeLedger.class);

    private final List<MergeRecord> records = new CopyOnWriteArrayList<>();

    public MergeRecord record(MergeRecord mergeRecord) {
        records.add(mergeRecord);
        log.info("ledger.merge absorbedId={} survivorId={} score={} membersMoved={} triggeredBy={}",
                mergeRecord.absorbedEventId(),
                mergeRecord.survivingEventId(),
                mergeRecord.score(),
                mergeRecord.membersMoved(),
                mergeRecord.triggeredBy());
        return mergeRecord;
    }

    public List<MergeRecord> getAllRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    public List<MergeRecord> getRecordsForSurvivor(String survivingEventId) {
        return records.stream()
                .filter(r -> r.survivingEventId().equals(survivingEventId))
                .collect(Collectors.toList());
    }

    public Optional<MergeRecord> findByAbsorbed(String absorbedEventId) {
        return records.stream()
                .filter(r -> r.absorbedEventId().equals(absorbedEventId))
                .findFirst();
    }

    public int size() {
        return records.size();
    }

    /**
     * All events absorbed into the given one, directly or through earlier merges.
     */
    public List<String> getMergeChain(String eventId) {
        List<String> chain = new ArrayList<>();
        collectMergeChain(eventId, chain);
        return chain;
    }

    private void collectMergeChain(String eventId, List<String> chain) {
        for (MergeRecord record : getRecordsForSurvivor(eventId)) {
            if (!chain.contains(record.absorbedEventId())) {
                chain.add(record.absorbedEventId());
                collectMergeChain(record.absorbedEventId(), chain);
            }
        }
    }
}
