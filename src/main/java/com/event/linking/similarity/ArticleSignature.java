package com.event.linking.similarity;

import com.event.linking.core.model.EventKey;
import com.event.linking.core.model.EventType;
import com.event.linking.core.model.Scope;

import java.time.LocalDate;
import java.util.Set;

/**
 * Normalized view of an article's attributes, as compared against events.
 *
 * @param key        the article's event key
 * @param sector     normalized sector, null when unknown
 * @param location   normalized location, null when unknown
 * @param actors     normalized actor names, possibly empty
 * @param scope      reported scope, null when unknown
 * @param eventType  reported action type, null when unknown
 * @param actionDate reported action date, null when unknown
 * @param headline   title plus summary, or a body prefix
 */
public record ArticleSignature(
        EventKey key,
        String sector,
        String location,
        Set<String> actors,
        Scope scope,
        EventType eventType,
        LocalDate actionDate,
        String headline
) {
    public ArticleSignature {
        actors = actors != null ? Set.copyOf(actors) : Set.of();
    }

    public boolean hasSector() {
        return sector != null;
    }

    public boolean hasLocation() {
        return location != null;
    }

    public boolean hasActionDate() {
        return actionDate != null;
    }
}
