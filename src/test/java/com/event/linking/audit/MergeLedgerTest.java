package com.event.linking.audit;

import com.event.linking.core.model.MergeRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MergeLedgerTest {

    private MergeLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new MergeLedger();
    }

    private MergeRecord merge(String absorbed, String survivor) {
        return ledger.record(MergeRecord.builder()
                .absorbedEventId(absorbed)
                .survivingEventId(survivor)
                .absorbedEventKey("maritime|pno|piraeus")
                .survivingEventKey("maritime|pno|piraeus|2024-03-05")
                .membersMoved(2)
                .score(0.91)
                .triggeredBy("reconciliation")
                .build());
    }

    @Test
    @DisplayName("Should record merges")
    void recordsMerge() {
        MergeRecord record = merge("e2", "e1");

        assertEquals(1, ledger.size());
        assertEquals("e2", record.absorbedEventId());
        assertEquals(2, record.membersMoved());
        assertEquals(record, ledger.findByAbsorbed("e2").orElseThrow());
        assertTrue(ledger.findByAbsorbed("e1").isEmpty());
    }

    @Test
    @DisplayName("Should list records by survivor")
    void bySurvivor() {
        merge("e2", "e1");
        merge("e3", "e1");
        merge("e5", "e4");

        assertEquals(2, ledger.getRecordsForSurvivor("e1").size());
    }

    @Test
    @DisplayName("Should follow merge chains")
    void mergeChain() {
        merge("e3", "e2");
        merge("e2", "e1");
        merge("e4", "e1");

        List<String> chain = ledger.getMergeChain("e1");

        assertEquals(3, chain.size());
        assertTrue(chain.containsAll(List.of("e2", "e3", "e4")));
        assertTrue(ledger.getMergeChain("e4").isEmpty());
    }

    @Test
    void recordsAreReadOnly() {
        merge("e2", "e1");

        assertThrows(UnsupportedOperationException.class, () -> ledger.getAllRecords().clear());
    }
}
