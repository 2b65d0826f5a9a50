package com.event.linking.core.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Confidence-scored attributes extracted upstream for one article.
 * Every field may be absent; absent attributes are represented by {@link Attribute#absent()}.
 */
public final class AttributeBundle {

    private static final AttributeBundle EMPTY = builder().build();

    private final Attribute<String> sector;
    private final Attribute<Scope> scope;
    private final Attribute<String> location;
    private final Attribute<LocalDate> actionDate;
    private final Attribute<EventType> eventType;
    private final List<Attribute<String>> actors;

    private AttributeBundle(Builder builder) {
        this.sector = orAbsent(builder.sector);
        this.scope = orAbsent(builder.scope);
        this.location = orAbsent(builder.location);
        this.actionDate = orAbsent(builder.actionDate);
        this.eventType = orAbsent(builder.eventType);
        this.actors = builder.actors.stream()
                .filter(Attribute::isPresent)
                .toList();
    }

    public static AttributeBundle empty() {
        return EMPTY;
    }

    public Attribute<String> getSector() {
        return sector;
    }

    public Attribute<Scope> getScope() {
        return scope;
    }

    public Attribute<String> getLocation() {
        return location;
    }

    public Attribute<LocalDate> getActionDate() {
        return actionDate;
    }

    public Attribute<EventType> getEventType() {
        return eventType;
    }

    public List<Attribute<String>> getActors() {
        return actors;
    }

    /**
     * The actor the extractor is most confident about. Ties go to the alphabetically first name.
     */
    public Optional<String> primaryActor() {
        return actors.stream()
                .min(Comparator.comparingDouble((Attribute<String> a) -> -a.confidence())
                        .thenComparing(Attribute::value))
                .map(Attribute::value);
    }

    public Set<String> actorNames() {
        Set<String> names = new LinkedHashSet<>();
        actors.forEach(a -> names.add(a.value()));
        return names;
    }

    public boolean isEmpty() {
        return !sector.isPresent() && !scope.isPresent() && !location.isPresent()
                && !actionDate.isPresent() && !eventType.isPresent() && actors.isEmpty();
    }

    /**
     * Mean confidence over the attributes that are present. Actors count as one attribute
     * scored by their mean. Returns 0.0 for an empty bundle.
     */
    public double meanConfidence() {
        double sum = 0.0;
        int count = 0;
        for (Attribute<?> attribute : List.of(sector, scope, location, actionDate, eventType)) {
            if (attribute.isPresent()) {
                sum += attribute.confidence();
                count++;
            }
        }
        if (!actors.isEmpty()) {
            sum += actors.stream().mapToDouble(Attribute::confidence).average().orElse(0.0);
            count++;
        }
        return count == 0 ? 0.0 : sum / count;
    }

    @Override
    public String toString() {
        return "AttributeBundle{" +
                "sector=" + sector.value() +
                ", scope=" + scope.value() +
                ", location=" + location.value() +
                ", actionDate=" + actionDate.value() +
                ", eventType=" + eventType.value() +
                ", actors=" + actorNames() +
                '}';
    }

    private static <T> Attribute<T> orAbsent(Attribute<T> attribute) {
        return attribute != null ? attribute : Attribute.absent();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Attribute<String> sector;
        private Attribute<Scope> scope;
        private Attribute<String> location;
        private Attribute<LocalDate> actionDate;
        private Attribute<EventType> eventType;
        private final List<Attribute<String>> actors = new ArrayList<>();

        public Builder sector(String value, double confidence) {
            this.sector = Attribute.of(value, confidence);
            return this;
        }

        public Builder scope(Scope value, double confidence) {
            this.scope = Attribute.of(value, confidence);
            return this;
        }

        public Builder location(String value, double confidence) {
            this.location = Attribute.of(value, confidence);
            return this;
        }

        public Builder actionDate(LocalDate value, double confidence) {
            this.actionDate = Attribute.of(value, confidence);
            return this;
        }

        public Builder eventType(EventType value, double confidence) {
            this.eventType = Attribute.of(value, confidence);
            return this;
        }

        public Builder actor(String name, double confidence) {
            this.actors.add(Attribute.of(name, confidence));
            return this;
        }

        public AttributeBundle build() {
            return new AttributeBundle(this);
        }
    }
}
