package io.tombwatch.model;

import java.time.Instant;

public record ProtocolEvent(
        String sourceNode,
        String rawLine,
        EventKind kind,
        Instant observedAt
) {
    public String dedupKey() {
        return rawLine;
    }
}
