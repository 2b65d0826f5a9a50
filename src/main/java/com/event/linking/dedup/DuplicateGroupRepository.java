package com.event.linking.dedup;

import com.event.linking.core.model.DuplicateGroup;
import com.event.linking.core.model.EventIntegrityException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Duplicate groups keyed by canonical article id, with a reverse index from every member.
 */
public class DuplicateGroupRepository {

    private final Map<String, DuplicateGroup> groups = new ConcurrentHashMap<>();
    private final Map<String, String> canonicalByMember = new ConcurrentHashMap<>();

    /**
     * Registers an original article as the canonical member of a new group.
     *
     * @throws EventIntegrityException if the article already belongs to a group
     */
    public DuplicateGroup seed(String canonicalArticleId) {
        ensureUnassigned(canonicalArticleId);
        DuplicateGroup group = DuplicateGroup.seed(canonicalArticleId);
        groups.put(canonicalArticleId, group);
        canonicalByMember.put(canonicalArticleId, canonicalArticleId);
        return group;
    }

    /**
     * Adds a duplicate to the group of the given canonical article.
     *
     * @throws EventIntegrityException if the group does not exist or the article belongs to a group
     */
    public DuplicateGroup addDuplicate(String canonicalArticleId, String duplicateArticleId) {
        DuplicateGroup group = groups.get(canonicalArticleId);
        if (group == null) {
            throw new EventIntegrityException("No duplicate group for canonical article " + canonicalArticleId);
        }
        ensureUnassigned(duplicateArticleId);
        DuplicateGroup updated = group.withMember(duplicateArticleId);
        groups.put(canonicalArticleId, updated);
        canonicalByMember.put(duplicateArticleId, canonicalArticleId);
        return updated;
    }

    /**
     * Removes an article from its group; a canonical article takes its whole group with it.
     */
    public void remove(String articleId) {
        String canonical = canonicalByMember.remove(articleId);
        if (canonical == null) {
            return;
        }
        if (canonical.equals(articleId)) {
            DuplicateGroup group = groups.remove(canonical);
            if (group != null) {
                group.getMemberIds().forEach(canonicalByMember::remove);
            }
            return;
        }
        DuplicateGroup group = groups.get(canonical);
        if (group != null) {
            DuplicateGroup rebuilt = DuplicateGroup.seed(canonical);
            for (String id : group.getDuplicateIds()) {
                if (!id.equals(articleId)) {
                    rebuilt = rebuilt.withMember(id);
                }
            }
            groups.put(canonical, rebuilt);
        }
    }

    public Optional<String> canonicalOf(String articleId) {
        return Optional.ofNullable(canonicalByMember.get(articleId));
    }

    public Optional<DuplicateGroup> findGroup(String canonicalArticleId) {
        return Optional.ofNullable(groups.get(canonicalArticleId));
    }

    public boolean isDuplicate(String articleId) {
        String canonical = canonicalByMember.get(articleId);
        return canonical != null && !canonical.equals(articleId);
    }

    /**
     * Non-canonical article id to canonical article id, sorted by article id.
     */
    public Map<String, String> duplicateMapping() {
        Map<String, String> mapping = new TreeMap<>();
        canonicalByMember.forEach((member, canonical) -> {
            if (!member.equals(canonical)) {
                mapping.put(member, canonical);
            }
        });
        return mapping;
    }

    public Collection<DuplicateGroup> findAll() {
        return List.copyOf(groups.values());
    }

    public int groupCount() {
        return groups.size();
    }

    private void ensureUnassigned(String articleId) {
        String existing = canonicalByMember.get(articleId);
        if (existing != null) {
            throw new EventIntegrityException("Article " + articleId
                    + " already belongs to the duplicate group of " + existing);
        }
    }
}
