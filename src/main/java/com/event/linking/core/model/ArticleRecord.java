package com.event.linking.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One ingested news item with its extracted attributes.
 * Immutable; assignment metadata lives in {@link ArticleAssignment}.
 */
public final class ArticleRecord {
    private final String id;
    private final String sourceUrl;
    private final String canonicalUrl;
    private final String title;
    private final String summary;
    private final String body;
    private final List<String> tags;
    private final String contentHash;
    private final Long simHash;
    private final Instant publishedAt;
    private final Instant ingestedAt;
    private final AttributeBundle attributes;

    private ArticleRecord(Builder builder) {
        this.id = builder.id;
        this.sourceUrl = builder.sourceUrl;
        this.canonicalUrl = builder.canonicalUrl != null ? builder.canonicalUrl : builder.sourceUrl;
        this.title = builder.title;
        this.summary = builder.summary;
        this.body = builder.body;
        this.tags = builder.tags != null ? List.copyOf(builder.tags) : List.of();
        this.contentHash = builder.contentHash;
        this.simHash = builder.simHash;
        this.publishedAt = builder.publishedAt;
        this.ingestedAt = builder.ingestedAt != null ? builder.ingestedAt : Instant.now();
        this.attributes = builder.attributes != null ? builder.attributes : AttributeBundle.empty();
    }

    public String getId() {
        return id;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public String getCanonicalUrl() {
        return canonicalUrl;
    }

    public String getTitle() {
        return title;
    }

    public String getSummary() {
        return summary;
    }

    public String getBody() {
        return body;
    }

    public List<String> getTags() {
        return tags;
    }

    /**
     * Raw-text fingerprint supplied upstream, or null when the engine should compute it.
     */
    public String getContentHash() {
        return contentHash;
    }

    /**
     * Locality-sensitive fingerprint supplied upstream, or null when the engine should compute it.
     */
    public Long getSimHash() {
        return simHash;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    public Instant getIngestedAt() {
        return ingestedAt;
    }

    public AttributeBundle getAttributes() {
        return attributes;
    }

    /**
     * Title and summary joined, the text used for semantic comparison against events.
     * Falls back to the start of the body when both are missing.
     */
    public String headlineText() {
        StringBuilder sb = new StringBuilder();
        if (title != null && !title.isBlank()) {
            sb.append(title.trim());
        }
        if (summary != null && !summary.isBlank()) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(summary.trim());
        }
        if (sb.length() == 0 && body != null) {
            String trimmed = body.trim();
            sb.append(trimmed, 0, Math.min(trimmed.length(), 500));
        }
        return sb.toString();
    }

    /**
     * Full text used for duplicate detection: title followed by body.
     */
    public String fullText() {
        StringBuilder sb = new StringBuilder();
        if (title != null) sb.append(title).append('\n');
        if (body != null) sb.append(body);
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(id, ((ArticleRecord) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ArticleRecord{" +
                "id='" + id + '\'' +
                ", canonicalUrl='" + canonicalUrl + '\'' +
                ", title='" + title + '\'' +
                ", publishedAt=" + publishedAt +
                ", attributes=" + attributes +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(ArticleRecord article) {
        return new Builder()
                .id(article.id)
                .sourceUrl(article.sourceUrl)
                .canonicalUrl(article.canonicalUrl)
                .title(article.title)
                .summary(article.summary)
                .body(article.body)
                .tags(article.tags)
                .contentHash(article.contentHash)
                .simHash(article.simHash)
                .publishedAt(article.publishedAt)
                .ingestedAt(article.ingestedAt)
                .attributes(article.attributes);
    }

    public static class Builder {
        private String id;
        private String sourceUrl;
        private String canonicalUrl;
        private String title;
        private String summary;
        private String body;
        private List<String> tags;
        private String contentHash;
        private Long simHash;
        private Instant publishedAt;
        private Instant ingestedAt;
        private AttributeBundle attributes;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sourceUrl(String sourceUrl) {
            this.sourceUrl = sourceUrl;
            return this;
        }

        public Builder canonicalUrl(String canonicalUrl) {
            this.canonicalUrl = canonicalUrl;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder contentHash(String contentHash) {
            this.contentHash = contentHash;
            return this;
        }

        public Builder simHash(Long simHash) {
            this.simHash = simHash;
            return this;
        }

        public Builder publishedAt(Instant publishedAt) {
            this.publishedAt = publishedAt;
            return this;
        }

        public Builder ingestedAt(Instant ingestedAt) {
            this.ingestedAt = ingestedAt;
            return this;
        }

        public Builder attributes(AttributeBundle attributes) {
            this.attributes = attributes;
            return this;
        }

        public ArticleRecord build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(publishedAt, "publishedAt is required");
            return new ArticleRecord(this);
        }
    }
}
