package io.tombwatch.observer;

import io.tombwatch.config.TombWatchSettings;
import io.tombwatch.model.EventKind;

import java.util.ArrayList;
import java.util.List;

public record EventMarkers(String tombstoneCreated, String partialDeleteFailure, String autoCleanup) {
    public EventMarkers {
        requireMarker(tombstoneCreated, EventKind.TOMBSTONE_CREATED);
        requireMarker(partialDeleteFailure, EventKind.PARTIAL_DELETE_FAILURE);
        requireMarker(autoCleanup, EventKind.AUTO_CLEANUP);
    }

    public static EventMarkers defaults() {
        return new EventMarkers(
                TombWatchSettings.DEFAULT_TOMBSTONE_MARKER,
                TombWatchSettings.DEFAULT_PARTIAL_FAILURE_MARKER,
                TombWatchSettings.DEFAULT_AUTO_CLEANUP_MARKER
        );
    }

    public static EventMarkers from(TombWatchSettings settings) {
        return new EventMarkers(
                settings.tombstoneMarker(),
                settings.partialFailureMarker(),
                settings.autoCleanupMarker()
        );
    }

    public String markerFor(EventKind kind) {
        return switch (kind) {
            case TOMBSTONE_CREATED -> tombstoneCreated;
            case PARTIAL_DELETE_FAILURE -> partialDeleteFailure;
            case AUTO_CLEANUP -> autoCleanup;
        };
    }

    // every kind whose marker occurs in the line, in declaration order
    public List<EventKind> classify(String line) {
        List<EventKind> out = new ArrayList<>(2);
        if (line == null || line.isEmpty()) {
            return out;
        }
        for (EventKind kind : EventKind.values()) {
            if (line.contains(markerFor(kind))) {
                out.add(kind);
            }
        }
        return out;
    }

    private static void requireMarker(String marker, EventKind kind) {
        if (marker == null || marker.isEmpty()) {
            throw new IllegalArgumentException("marker cannot be empty: " + kind.label());
        }
    }
}
