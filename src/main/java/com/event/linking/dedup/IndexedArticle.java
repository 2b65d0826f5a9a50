package com.event.linking.dedup;

import java.time.Instant;
import java.util.Objects;

/**
 * An article as known to the duplicate index.
 */
public record IndexedArticle(
        String articleId,
        String canonicalUrl,
        String contentHash,
        Long simHash,
        Instant publishedAt
) {
    public IndexedArticle {
        Objects.requireNonNull(articleId, "articleId is required");
        Objects.requireNonNull(publishedAt, "publishedAt is required");
    }
}
