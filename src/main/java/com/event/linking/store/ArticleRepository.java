package com.event.linking.store;

import com.event.linking.core.model.ArticleAssignment;
import com.event.linking.core.model.ArticleRecord;

import java.util.List;
import java.util.Optional;

/**
 * Registered articles and their assignments.
 */
public interface ArticleRepository {

    /**
     * Registers an article unless one with the same id exists.
     *
     * @return true if the article was registered by this call
     */
    boolean register(ArticleRecord article);

    void unregister(String articleId);

    Optional<ArticleRecord> findArticle(String articleId);

    void saveAssignment(ArticleAssignment assignment);

    void deleteAssignment(String articleId);

    Optional<ArticleAssignment> findAssignment(String articleId);

    List<ArticleAssignment> findAssignmentsByEvent(String eventId);

    /**
     * Points every assignment of one event at another.
     *
     * @return the assignments as they were before the change
     */
    List<ArticleAssignment> repointAssignments(String fromEventId, String toEventId);

    int articleCount();
}
