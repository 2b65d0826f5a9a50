package com.event.linking.store;

import com.event.linking.core.model.Event;
import com.event.linking.core.model.EventState;

import java.util.List;
import java.util.Optional;

/**
 * Versioned store of event snapshots.
 *
 * <p>Every write is compare-and-set against the version the new snapshot was derived from.
 * The store also tracks which surviving event each member article belongs to and refuses
 * writes that would place an article in two surviving events.</p>
 */
public interface EventStore {

    Optional<Event> findById(String eventId);

    /**
     * Stores a new event at version 1.
     *
     * @throws com.event.linking.core.model.EventIntegrityException if the id exists or a member
     *                                                              belongs to another event
     */
    Event insert(Event event);

    /**
     * Replaces the event if its stored version still equals {@code expectedVersion}.
     *
     * @return the stored snapshot, at {@code expectedVersion + 1}
     * @throws StaleEventException if the stored version differs
     */
    Event update(Event event, long expectedVersion);

    /**
     * Atomically stores a merge: the survivor with its new members and the absorbed event,
     * both compare-and-set against their expected versions.
     */
    MergedPair merge(Event survivor, long survivorVersion, Event absorbed, long absorbedVersion);

    /**
     * Removes an event. Used to compensate an insert.
     */
    void delete(String eventId);

    /**
     * Puts a snapshot back unconditionally, keeping its version. Used to compensate an update.
     */
    void restore(Event snapshot);

    List<Event> findByShard(String shardKey);

    List<Event> findBySector(String sector);

    /**
     * Events whose key, ignoring the date bucket, equals the given undated key value.
     */
    List<Event> findByUndatedKey(String undatedKey);

    List<Event> findByState(EventState state);

    List<Event> findAll();

    /**
     * Events not absorbed by a reconciliation merge.
     */
    List<Event> findSurviving();

    /**
     * Surviving event an article is a member of.
     */
    Optional<String> findEventIdForArticle(String articleId);

    /**
     * Monotonic counter incremented by every write. Equal versions mean equal contents.
     */
    long version();

    int size();

    record MergedPair(Event survivor, Event absorbed) {
    }
}
