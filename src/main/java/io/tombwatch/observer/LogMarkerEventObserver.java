package io.tombwatch.observer;

import io.tombwatch.cluster.ClusterControlPort;
import io.tombwatch.model.EventKind;
import io.tombwatch.model.ProtocolEvent;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class LogMarkerEventObserver implements EventObserver {
    private final ClusterControlPort control;
    private final EventMarkers markers;
    private final Clock clock;

    public LogMarkerEventObserver(ClusterControlPort control, EventMarkers markers) {
        this(control, markers, Clock.systemUTC());
    }

    public LogMarkerEventObserver(ClusterControlPort control, EventMarkers markers, Clock clock) {
        this.control = control;
        this.markers = markers;
        this.clock = clock;
    }

    @Override
    public Collection<ProtocolEvent> scan(String nodeId, Set<EventKind> kinds, Collection<ProtocolEvent> sinceEvents) {
        String text = control.fetchLogs(nodeId);
        return classify(nodeId, text, kinds, sinceEvents, clock.instant());
    }

    List<ProtocolEvent> classify(
            String nodeId,
            String text,
            Set<EventKind> kinds,
            Collection<ProtocolEvent> sinceEvents,
            Instant observedAt
    ) {
        List<ProtocolEvent> out = new ArrayList<>();
        if (text == null || text.isEmpty() || kinds == null || kinds.isEmpty()) {
            return out;
        }
        Set<String> seen = new HashSet<>();
        if (sinceEvents != null) {
            for (ProtocolEvent event : sinceEvents) {
                seen.add(event.dedupKey());
            }
        }
        for (String rawLine : text.split("\n")) {
            String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
            if (seen.contains(line)) {
                continue;
            }
            boolean matched = false;
            for (EventKind kind : markers.classify(line)) {
                if (kinds.contains(kind)) {
                    out.add(new ProtocolEvent(nodeId, line, kind, observedAt));
                    matched = true;
                }
            }
            if (matched) {
                seen.add(line);
            }
        }
        return out;
    }

    @Override
    public int countMarker(String nodeId, EventKind kind) {
        String text = control.fetchLogs(nodeId);
        if (text == null || text.isEmpty()) {
            return 0;
        }
        String marker = markers.markerFor(kind);
        int count = 0;
        int from = 0;
        while (true) {
            int at = text.indexOf(marker, from);
            if (at < 0) {
                return count;
            }
            count++;
            from = at + marker.length();
        }
    }
}
