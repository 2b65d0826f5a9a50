package com.event.linking.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * A canonical real-world labour action: aggregated attributes plus the original articles reporting it.
 *
 * <p>Instances are immutable snapshots. Every change produces a new snapshot through
 * {@link #builder(Event)}; the event store accepts it only if the version it was derived
 * from is still current.</p>
 */
public final class Event {
    private final String id;
    private final EventKey key;
    private final String sector;
    private final Scope scope;
    private final EventType eventType;
    private final Set<String> locations;
    private final Set<String> actors;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final EventState state;
    private final double severity;
    private final double confidence;
    private final Instant lastActivityAt;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant closedAt;
    private final String mergedIntoId;
    private final List<EventMember> members;
    private final List<String> representativeTexts;
    private final long version;

    private Event(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.key = builder.key;
        this.sector = builder.sector;
        this.scope = builder.scope;
        this.eventType = builder.eventType;
        this.locations = Collections.unmodifiableSet(new TreeSet<>(builder.locations));
        this.actors = Collections.unmodifiableSet(new TreeSet<>(builder.actors));
        this.startDate = builder.startDate;
        this.endDate = builder.endDate;
        this.state = builder.state != null ? builder.state : EventState.OPEN;
        this.severity = builder.severity;
        this.confidence = builder.confidence;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
        this.closedAt = builder.closedAt;
        this.mergedIntoId = builder.mergedIntoId;
        List<EventMember> sorted = new ArrayList<>(builder.members);
        sorted.sort(EventMember.PUBLICATION_ORDER);
        this.members = Collections.unmodifiableList(sorted);
        this.lastActivityAt = builder.lastActivityAt;
        this.representativeTexts = List.copyOf(builder.representativeTexts);
        this.version = builder.version;
    }

    public String getId() {
        return id;
    }

    public EventKey getKey() {
        return key;
    }

    public String getShardKey() {
        return key.shardKey();
    }

    public String getSector() {
        return sector;
    }

    public Scope getScope() {
        return scope;
    }

    public EventType getEventType() {
        return eventType;
    }

    public Set<String> getLocations() {
        return locations;
    }

    public Set<String> getActors() {
        return actors;
    }

    /**
     * Earliest known action date, null when unbounded.
     */
    public LocalDate getStartDate() {
        return startDate;
    }

    /**
     * Latest known action date, null when unbounded.
     */
    public LocalDate getEndDate() {
        return endDate;
    }

    public EventState getState() {
        return state;
    }

    public double getSeverity() {
        return severity;
    }

    public double getConfidence() {
        return confidence;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    /**
     * Surviving event this one was absorbed into by reconciliation, null otherwise.
     */
    public String getMergedIntoId() {
        return mergedIntoId;
    }

    public List<EventMember> getMembers() {
        return members;
    }

    public List<String> getMemberIds() {
        return members.stream().map(EventMember::articleId).toList();
    }

    public List<String> getRepresentativeTexts() {
        return representativeTexts;
    }

    public long getVersion() {
        return version;
    }

    public int memberCount() {
        return members.size();
    }

    public boolean hasMember(String articleId) {
        return members.stream().anyMatch(m -> m.articleId().equals(articleId));
    }

    public boolean isAbsorbed() {
        return mergedIntoId != null;
    }

    public boolean isOpen() {
        return state == EventState.OPEN;
    }

    public boolean isDormant() {
        return state == EventState.DORMANT;
    }

    public boolean isClosed() {
        return state == EventState.CLOSED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Event event = (Event) o;
        return version == event.version && Objects.equals(id, event.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return "Event{" +
                "id='" + id + '\'' +
                ", key=" + key +
                ", state=" + state +
                ", members=" + members.size() +
                ", startDate=" + startDate +
                ", endDate=" + endDate +
                ", severity=" + severity +
                ", version=" + version +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Event event) {
        Builder builder = new Builder()
                .id(event.id)
                .key(event.key)
                .sector(event.sector)
                .scope(event.scope)
                .eventType(event.eventType)
                .startDate(event.startDate)
                .endDate(event.endDate)
                .state(event.state)
                .severity(event.severity)
                .confidence(event.confidence)
                .lastActivityAt(event.lastActivityAt)
                .createdAt(event.createdAt)
                .updatedAt(event.updatedAt)
                .closedAt(event.closedAt)
                .mergedIntoId(event.mergedIntoId)
                .representativeTexts(event.representativeTexts)
                .version(event.version);
        builder.locations.addAll(event.locations);
        builder.actors.addAll(event.actors);
        builder.members.addAll(event.members);
        return builder;
    }

    public static class Builder {
        private String id;
        private EventKey key;
        private String sector;
        private Scope scope;
        private EventType eventType;
        private final Set<String> locations = new TreeSet<>();
        private final Set<String> actors = new TreeSet<>();
        private LocalDate startDate;
        private LocalDate endDate;
        private EventState state;
        private double severity;
        private double confidence;
        private Instant lastActivityAt;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant closedAt;
        private String mergedIntoId;
        private final List<EventMember> members = new ArrayList<>();
        private List<String> representativeTexts = List.of();
        private long version;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder key(EventKey key) {
            this.key = key;
            return this;
        }

        public Builder sector(String sector) {
            this.sector = sector;
            return this;
        }

        public Builder scope(Scope scope) {
            this.scope = scope;
            return this;
        }

        public Builder eventType(EventType eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder addLocation(String location) {
            if (location != null && !location.isBlank()) {
                this.locations.add(location);
            }
            return this;
        }

        public Builder addLocations(Set<String> locations) {
            locations.forEach(this::addLocation);
            return this;
        }

        public Builder addActor(String actor) {
            if (actor != null && !actor.isBlank()) {
                this.actors.add(actor);
            }
            return this;
        }

        public Builder addActors(Set<String> actors) {
            actors.forEach(this::addActor);
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder state(EventState state) {
            this.state = state;
            return this;
        }

        public Builder severity(double severity) {
            this.severity = severity;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder lastActivityAt(Instant lastActivityAt) {
            this.lastActivityAt = lastActivityAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder closedAt(Instant closedAt) {
            this.closedAt = closedAt;
            return this;
        }

        public Builder mergedIntoId(String mergedIntoId) {
            this.mergedIntoId = mergedIntoId;
            return this;
        }

        public Builder addMember(EventMember member) {
            this.members.add(member);
            return this;
        }

        public Builder removeMember(String articleId) {
            this.members.removeIf(m -> m.articleId().equals(articleId));
            return this;
        }

        public Builder addMembers(List<EventMember> members) {
            this.members.addAll(members);
            return this;
        }

        public Builder representativeTexts(List<String> representativeTexts) {
            this.representativeTexts = representativeTexts != null ? representativeTexts : List.of();
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        /**
         * Builds the snapshot, rejecting states that break event invariants.
         *
         * @throws EventIntegrityException if the date span is inverted, a member is listed twice
         *                                 or the event has no member
         */
        public Event build() {
            Objects.requireNonNull(key, "key is required");
            if (members.isEmpty()) {
                throw new EventIntegrityException("Event " + id + " has no member articles");
            }
            if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
                throw new EventIntegrityException("Event " + id + " start date " + startDate
                        + " is after end date " + endDate);
            }
            long distinct = members.stream().map(EventMember::articleId).distinct().count();
            if (distinct != members.size()) {
                throw new EventIntegrityException("Event " + id + " lists a member article twice");
            }
            if (lastActivityAt == null) {
                lastActivityAt = members.stream()
                        .map(EventMember::publishedAt)
                        .max(Instant::compareTo)
                        .orElseThrow();
            }
            return new Event(this);
        }
    }
}
