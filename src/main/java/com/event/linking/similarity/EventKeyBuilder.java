package com.event.linking.similarity;

import com.event.linking.core.model.ArticleRecord;
import com.event.linking.core.model.Attribute;
import com.event.linking.core.model.AttributeBundle;
import com.event.linking.core.model.EventKey;
import com.event.linking.rules.NormalizationEngine;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Derives the coarse {@link EventKey} and the normalized {@link ArticleSignature} of an article.
 *
 * <p>Key layout is {@code sector|actor|location[|date]}: components go through the
 * {@link NormalizationEngine} (and therefore its alias table), missing components become
 * {@value EventKey#UNKNOWN}, and the date component is dropped when the action date is unknown.
 * The primary actor is the highest-confidence actor, ties broken by normalized name.</p>
 */
public class EventKeyBuilder {

    private final NormalizationEngine engine;

    public EventKeyBuilder(NormalizationEngine engine) {
        this.engine = engine;
    }

    public NormalizationEngine getEngine() {
        return engine;
    }

    public EventKey build(AttributeBundle attributes) {
        return new EventKey(
                normalizedSector(attributes).orElse(null),
                primaryActor(attributes).orElse(null),
                normalizedLocation(attributes).orElse(null),
                attributes.getActionDate().value());
    }

    public ArticleSignature signature(ArticleRecord article) {
        AttributeBundle attributes = article.getAttributes();
        return new ArticleSignature(
                build(attributes),
                normalizedSector(attributes).orElse(null),
                normalizedLocation(attributes).orElse(null),
                normalizedActors(attributes),
                attributes.getScope().value(),
                attributes.getEventType().value(),
                attributes.getActionDate().value(),
                article.headlineText());
    }

    public Optional<String> normalizedSector(AttributeBundle attributes) {
        return nonBlank(engine.normalizeSector(attributes.getSector().value()));
    }

    public Optional<String> normalizedLocation(AttributeBundle attributes) {
        return nonBlank(engine.normalizeLocation(attributes.getLocation().value()));
    }

    /**
     * Normalized actor names; variants of the same actor collapse to one entry.
     */
    public Set<String> normalizedActors(AttributeBundle attributes) {
        Set<String> names = new LinkedHashSet<>();
        for (Attribute<String> actor : attributes.getActors()) {
            nonBlank(engine.normalizeActor(actor.value())).ifPresent(names::add);
        }
        return names;
    }

    public Optional<String> primaryActor(AttributeBundle attributes) {
        return attributes.getActors().stream()
                .map(actor -> new NormalizedActor(engine.normalizeActor(actor.value()), actor.confidence()))
                .filter(actor -> !actor.name().isEmpty())
                .min(Comparator.comparingDouble(NormalizedActor::confidence).reversed()
                        .thenComparing(NormalizedActor::name))
                .map(NormalizedActor::name);
    }

    /**
     * Shard key of the article: {@code sector|location}.
     */
    public String shardKey(AttributeBundle attributes) {
        return build(attributes).shardKey();
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private record NormalizedActor(String name, double confidence) {
    }
}
