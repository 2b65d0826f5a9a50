package com.event.linking.store;

import com.event.linking.core.model.Event;
import com.event.linking.core.model.EventIntegrityException;
import com.event.linking.core.model.EventMember;
import com.event.linking.core.model.EventState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link EventStore}. Reads are lock-free over concurrent maps; writes are
 * serialized on the store instance.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private static final Comparator<Event> CREATION_ORDER =
            Comparator.comparing(Event::getCreatedAt).thenComparing(Event::getId);

    private final Map<String, Event> events = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> byShard = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> bySector = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> byUndatedKey = new ConcurrentHashMap<>();
    private final Map<String, String> eventByArticle = new ConcurrentHashMap<>();
    private final AtomicLong storeVersion = new AtomicLong();

    @Override
    public Optional<Event> findById(String eventId) {
        return Optional.ofNullable(events.get(eventId));
    }

    @Override
    public synchronized Event insert(Event event) {
        Objects.requireNonNull(event, "event is required");
        if (events.containsKey(event.getId())) {
            throw new EventIntegrityException("Event already exists: " + event.getId());
        }
        checkMembership(event);
        Event stored = Event.builder(event).version(1).build();
        put(stored);
        log.debug("store.inserted eventId={} shard={}", stored.getId(), stored.getShardKey());
        return stored;
    }

    @Override
    public synchronized Event update(Event event, long expectedVersion) {
        Objects.requireNonNull(event, "event is required");
        Event current = requireVersion(event.getId(), expectedVersion);
        checkMembership(event);
        Event stored = Event.builder(event).version(expectedVersion + 1).build();
        unindex(current);
        put(stored);
        log.debug("store.updated eventId={} version={}", stored.getId(), stored.getVersion());
        return stored;
    }

    @Override
    public synchronized MergedPair merge(Event survivor, long survivorVersion, Event absorbed, long absorbedVersion) {
        if (survivor.getId().equals(absorbed.getId())) {
            throw new EventIntegrityException("Cannot merge event " + survivor.getId() + " into itself");
        }
        if (!survivor.getId().equals(absorbed.getMergedIntoId())) {
            throw new EventIntegrityException("Absorbed event " + absorbed.getId()
                    + " must point at survivor " + survivor.getId());
        }
        Event currentSurvivor = requireVersion(survivor.getId(), survivorVersion);
        Event currentAbsorbed = requireVersion(absorbed.getId(), absorbedVersion);

        for (EventMember member : survivor.getMembers()) {
            String owner = eventByArticle.get(member.articleId());
            if (owner != null && !owner.equals(survivor.getId()) && !owner.equals(absorbed.getId())) {
                throw new EventIntegrityException("Article " + member.articleId()
                        + " already belongs to event " + owner);
            }
        }

        Event storedAbsorbed = Event.builder(absorbed).version(absorbedVersion + 1).build();
        Event storedSurvivor = Event.builder(survivor).version(survivorVersion + 1).build();
        unindex(currentAbsorbed);
        unindex(currentSurvivor);
        put(storedAbsorbed);
        put(storedSurvivor);
        log.debug("store.merged survivorId={} absorbedId={}", survivor.getId(), absorbed.getId());
        return new MergedPair(storedSurvivor, storedAbsorbed);
    }

    @Override
    public synchronized void delete(String eventId) {
        Event removed = events.remove(eventId);
        if (removed != null) {
            unindex(removed);
            storeVersion.incrementAndGet();
        }
    }

    @Override
    public synchronized void restore(Event snapshot) {
        Event current = events.get(snapshot.getId());
        if (current != null) {
            unindex(current);
        }
        put(snapshot);
        log.debug("store.restored eventId={} version={}", snapshot.getId(), snapshot.getVersion());
    }

    @Override
    public List<Event> findByShard(String shardKey) {
        return resolve(byShard.get(shardKey));
    }

    @Override
    public List<Event> findBySector(String sector) {
        return resolve(bySector.get(sector));
    }

    @Override
    public List<Event> findByUndatedKey(String undatedKey) {
        return resolve(byUndatedKey.get(undatedKey));
    }

    @Override
    public List<Event> findByState(EventState state) {
        return events.values().stream()
                .filter(e -> e.getState() == state)
                .sorted(CREATION_ORDER)
                .toList();
    }

    @Override
    public List<Event> findAll() {
        return events.values().stream().sorted(CREATION_ORDER).toList();
    }

    @Override
    public List<Event> findSurviving() {
        return events.values().stream()
                .filter(e -> !e.isAbsorbed())
                .sorted(CREATION_ORDER)
                .toList();
    }

    @Override
    public Optional<String> findEventIdForArticle(String articleId) {
        return Optional.ofNullable(eventByArticle.get(articleId));
    }

    @Override
    public long version() {
        return storeVersion.get();
    }

    @Override
    public int size() {
        return events.size();
    }

    private Event requireVersion(String eventId, long expectedVersion) {
        Event current = events.get(eventId);
        if (current == null) {
            throw new EventIntegrityException("Event not found: " + eventId);
        }
        if (current.getVersion() != expectedVersion) {
            throw new StaleEventException(eventId, expectedVersion, current.getVersion());
        }
        return current;
    }

    private void checkMembership(Event event) {
        if (event.isAbsorbed()) {
            return;
        }
        for (EventMember member : event.getMembers()) {
            String owner = eventByArticle.get(member.articleId());
            if (owner != null && !owner.equals(event.getId())) {
                throw new EventIntegrityException("Article " + member.articleId()
                        + " already belongs to event " + owner);
            }
        }
    }

    private void put(Event event) {
        events.put(event.getId(), event);
        byShard.computeIfAbsent(event.getShardKey(), k -> ConcurrentHashMap.newKeySet()).add(event.getId());
        if (event.getSector() != null) {
            bySector.computeIfAbsent(event.getSector(), k -> ConcurrentHashMap.newKeySet()).add(event.getId());
        }
        byUndatedKey.computeIfAbsent(event.getKey().undatedValue(), k -> ConcurrentHashMap.newKeySet())
                .add(event.getId());
        if (!event.isAbsorbed()) {
            for (String articleId : event.getMemberIds()) {
                eventByArticle.put(articleId, event.getId());
            }
        }
        storeVersion.incrementAndGet();
    }

    private void unindex(Event event) {
        removeFrom(byShard, event.getShardKey(), event.getId());
        removeFrom(bySector, event.getSector(), event.getId());
        removeFrom(byUndatedKey, event.getKey().undatedValue(), event.getId());
        for (String articleId : event.getMemberIds()) {
            eventByArticle.remove(articleId, event.getId());
        }
    }

    private List<Event> resolve(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return ids.stream()
                .map(events::get)
                .filter(Objects::nonNull)
                .sorted(CREATION_ORDER)
                .toList();
    }

    private static void removeFrom(Map<String, Set<String>> index, String key, String eventId) {
        if (key == null) {
            return;
        }
        Set<String> ids = index.get(key);
        if (ids != null) {
            ids.remove(eventId);
        }
    }
}
