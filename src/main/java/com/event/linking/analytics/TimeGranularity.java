package com.event.linking.analytics;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;

/**
 * Bucket size for analytics timelines.
 */
public enum TimeGranularity {
    /**
     * ISO week, starting Monday.
     */
    WEEK {
        @Override
        public LocalDate bucketStart(LocalDate date) {
            return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        }

        @Override
        public String label(LocalDate bucketStart) {
            return String.format("%d-W%02d",
                    bucketStart.get(IsoFields.WEEK_BASED_YEAR),
                    bucketStart.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        }
    },

    /**
     * Calendar month.
     */
    MONTH {
        @Override
        public LocalDate bucketStart(LocalDate date) {
            return date.withDayOfMonth(1);
        }

        @Override
        public String label(LocalDate bucketStart) {
            return String.format("%d-%02d", bucketStart.getYear(), bucketStart.getMonthValue());
        }
    };

    /**
     * First day of the bucket containing the date.
     */
    public abstract LocalDate bucketStart(LocalDate date);

    /**
     * Display label of a bucket, e.g. {@code 2024-W07} or {@code 2024-02}.
     */
    public abstract String label(LocalDate bucketStart);
}
