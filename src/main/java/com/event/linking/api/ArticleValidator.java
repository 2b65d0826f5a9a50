package com.event.linking.api;

import com.event.linking.core.model.ArticleRecord;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Validates articles before any state is touched.
 */
public final class ArticleValidator {

    private ArticleValidator() {
        // Utility class
    }

    /**
     * @throws IllegalArgumentException if the article is null, its id is blank or it has no
     *                                  publication time
     */
    public static void validate(ArticleRecord article) {
        if (article == null) {
            throw new IllegalArgumentException("Article must not be null");
        }
        if (article.getId() == null || article.getId().isBlank()) {
            throw new IllegalArgumentException("Article id must not be blank");
        }
        if (article.getPublishedAt() == null) {
            throw new IllegalArgumentException("Article " + article.getId() + " has no publication time");
        }
    }

    /**
     * Validates every article of a batch and the batch size.
     * Repeated ids are allowed; later copies are reported as already processed.
     *
     * @return number of distinct article ids
     */
    public static int validateBatch(Collection<ArticleRecord> articles, int maxBatchSize) {
        if (articles == null) {
            throw new IllegalArgumentException("Batch must not be null");
        }
        if (articles.size() > maxBatchSize) {
            throw new IllegalArgumentException("Batch of " + articles.size()
                    + " articles exceeds the maximum of " + maxBatchSize);
        }
        Set<String> ids = new HashSet<>();
        for (ArticleRecord article : articles) {
            validate(article);
            ids.add(article.getId());
        }
        return ids.size();
    }
}
