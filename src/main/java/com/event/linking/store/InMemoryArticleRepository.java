package com.event.linking.store;

import com.event.linking.core.model.ArticleAssignment;
import com.event.linking.core.model.ArticleRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link ArticleRepository} backed by concurrent maps.
 */
public class InMemoryArticleRepository implements ArticleRepository {

    private final Map<String, ArticleRecord> articles = new ConcurrentHashMap<>();
    private final Map<String, ArticleAssignment> assignments = new ConcurrentHashMap<>();

    @Override
    public boolean register(ArticleRecord article) {
        return articles.putIfAbsent(article.getId(), article) == null;
    }

    @Override
    public void unregister(String articleId) {
        articles.remove(articleId);
    }

    @Override
    public Optional<ArticleRecord> findArticle(String articleId) {
        return Optional.ofNullable(articles.get(articleId));
    }

    @Override
    public void saveAssignment(ArticleAssignment assignment) {
        assignments.put(assignment.articleId(), assignment);
    }

    @Override
    public void deleteAssignment(String articleId) {
        assignments.remove(articleId);
    }

    @Override
    public Optional<ArticleAssignment> findAssignment(String articleId) {
        return Optional.ofNullable(assignments.get(articleId));
    }

    @Override
    public List<ArticleAssignment> findAssignmentsByEvent(String eventId) {
        return assignments.values().stream()
                .filter(a -> eventId.equals(a.eventId()))
                .sorted(Comparator.comparing(ArticleAssignment::articleId))
                .toList();
    }

    @Override
    public synchronized List<ArticleAssignment> repointAssignments(String fromEventId, String toEventId) {
        List<ArticleAssignment> previous = new ArrayList<>(findAssignmentsByEvent(fromEventId));
        for (ArticleAssignment assignment : previous) {
            assignments.put(assignment.articleId(), assignment.withEventId(toEventId));
        }
        return previous;
    }

    @Override
    public int articleCount() {
        return articles.size();
    }
}
