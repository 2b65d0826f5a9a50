package com.event.linking.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Articles deemed to carry the same text. The canonical article is always the first member.
 * Groups only grow: {@link #withMember(String)} returns a new group with the duplicate appended.
 */
public final class DuplicateGroup {
    private final String canonicalArticleId;
    private final List<String> memberIds;

    private DuplicateGroup(String canonicalArticleId, List<String> memberIds) {
        this.canonicalArticleId = canonicalArticleId;
        this.memberIds = Collections.unmodifiableList(memberIds);
    }

    public static DuplicateGroup seed(String canonicalArticleId) {
        Objects.requireNonNull(canonicalArticleId, "canonicalArticleId is required");
        List<String> members = new ArrayList<>();
        members.add(canonicalArticleId);
        return new DuplicateGroup(canonicalArticleId, members);
    }

    public DuplicateGroup withMember(String duplicateArticleId) {
        Objects.requireNonNull(duplicateArticleId, "duplicateArticleId is required");
        if (memberIds.contains(duplicateArticleId)) {
            return this;
        }
        List<String> members = new ArrayList<>(memberIds);
        members.add(duplicateArticleId);
        return new DuplicateGroup(canonicalArticleId, members);
    }

    public String getCanonicalArticleId() {
        return canonicalArticleId;
    }

    public List<String> getMemberIds() {
        return memberIds;
    }

    /**
     * Members other than the canonical article.
     */
    public List<String> getDuplicateIds() {
        return memberIds.subList(1, memberIds.size());
    }

    public boolean contains(String articleId) {
        return memberIds.contains(articleId);
    }

    public int size() {
        return memberIds.size();
    }

    @Override
    public String toString() {
        return "DuplicateGroup{canonical='" + canonicalArticleId + "', members=" + memberIds + '}';
    }
}
