package com.event.linking.analytics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class TimeGranularityTest {

    @ParameterizedTest
    @CsvSource({
            "2024-03-01, 2024-02-26, 2024-W09",
            "2024-03-04, 2024-03-04, 2024-W10",
            "2024-03-10, 2024-03-04, 2024-W10",
            "2024-12-31, 2024-12-30, 2025-W01"
    })
    @DisplayName("Weeks start on Monday and use the ISO week-based year")
    void weekBuckets(String date, String expectedStart, String expectedLabel) {
        LocalDate start = TimeGranularity.WEEK.bucketStart(LocalDate.parse(date));

        assertEquals(LocalDate.parse(expectedStart), start);
        assertEquals(expectedLabel, TimeGranularity.WEEK.label(start));
    }

    @ParameterizedTest
    @CsvSource({
            "2024-03-17, 2024-03-01, 2024-03",
            "2024-12-31, 2024-12-01, 2024-12"
    })
    void monthBuckets(String date, String expectedStart, String expectedLabel) {
        LocalDate start = TimeGranularity.MONTH.bucketStart(LocalDate.parse(date));

        assertEquals(LocalDate.parse(expectedStart), start);
        assertEquals(expectedLabel, TimeGranularity.MONTH.label(start));
    }

    @Test
    void bucketStartIsIdempotent() {
        LocalDate start = TimeGranularity.WEEK.bucketStart(LocalDate.of(2024, 5, 16));
        assertEquals(start, TimeGranularity.WEEK.bucketStart(start));
    }
}
