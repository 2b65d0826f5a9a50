package com.event.linking.api;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LinkingOptionsTest {

    @Test
    void defaultWindows() {
        LinkingOptions options = LinkingOptions.defaults();

        assertEquals(Duration.ofDays(14), options.getMatchWindow());
        assertEquals(Duration.ofDays(14), options.getDormancyWindow());
        assertEquals(Duration.ofDays(45), options.getClosureWindow());
        assertEquals(Duration.ofDays(7), options.getClosedMergeGracePeriod());
        assertEquals(0.55, options.getAcceptanceThreshold());
    }

    @Test
    void closureMustOutlastDormancy() {
        assertThrows(IllegalArgumentException.class, () -> LinkingOptions.builder()
                .dormancyWindow(Duration.ofDays(10))
                .closureWindow(Duration.ofDays(10))
                .build());
    }

    @Test
    void copyKeepsEverySetting() {
        LinkingOptions custom = LinkingOptions.builder()
                .matchWindow(Duration.ofDays(7))
                .dormancyWindow(Duration.ofDays(5))
                .closureWindow(Duration.ofDays(20))
                .batchParallelism(2)
                .build();

        LinkingOptions copy = LinkingOptions.builder(custom).build();

        assertEquals(Duration.ofDays(7), copy.getMatchWindow());
        assertEquals(Duration.ofDays(5), copy.getDormancyWindow());
        assertEquals(Duration.ofDays(20), copy.getClosureWindow());
        assertEquals(2, copy.getBatchParallelism());
    }
}
