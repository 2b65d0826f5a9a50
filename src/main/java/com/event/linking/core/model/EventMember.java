package com.event.linking.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * Reference to an original article inside an event.
 *
 * @param articleId           the member article
 * @param publishedAt         publication time, defines member order
 * @param actionDate          action date reported by the article, null when unknown
 * @param attributeConfidence mean upstream attribute confidence of the article
 * @param lowConfidence       whether the assignment was flagged low-confidence
 */
public record EventMember(
        String articleId,
        Instant publishedAt,
        LocalDate actionDate,
        double attributeConfidence,
        boolean lowConfidence
) {
    public static final Comparator<EventMember> PUBLICATION_ORDER =
            Comparator.comparing(EventMember::publishedAt).thenComparing(EventMember::articleId);

    public EventMember {
        Objects.requireNonNull(articleId, "articleId is required");
        Objects.requireNonNull(publishedAt, "publishedAt is required");
    }
}
