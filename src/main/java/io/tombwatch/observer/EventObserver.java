package io.tombwatch.observer;

import io.tombwatch.model.EventKind;
import io.tombwatch.model.ProtocolEvent;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Turns a node's output into protocol events.
 *
 * <p>Scans are idempotent: a raw line already present in {@code sinceEvents} is never
 * returned again, so callers can poll the same log window repeatedly and accumulate results.
 */
public interface EventObserver {
    Collection<ProtocolEvent> scan(String nodeId, Set<EventKind> kinds, Collection<ProtocolEvent> sinceEvents);

    default Collection<ProtocolEvent> scan(String nodeId, Collection<ProtocolEvent> sinceEvents) {
        return scan(nodeId, EnumSet.allOf(EventKind.class), sinceEvents);
    }

    default Collection<ProtocolEvent> scan(String nodeId, EventKind kind, Collection<ProtocolEvent> sinceEvents) {
        return scan(nodeId, EnumSet.of(kind), sinceEvents);
    }

    int countMarker(String nodeId, EventKind kind);
}
