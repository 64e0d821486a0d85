package io.tombwatch.poller;

import io.tombwatch.model.OrphanFile;
import io.tombwatch.model.ProtocolEvent;

import java.util.List;

public record ConvergenceOutcome(
        boolean converged,
        List<ProtocolEvent> eventsSeen,
        int polls,
        long elapsedMs,
        List<OrphanFile> remaining,
        List<String> inspectionErrors,
        boolean cancelled
) {
    public ConvergenceOutcome {
        eventsSeen = eventsSeen == null ? List.of() : List.copyOf(eventsSeen);
        remaining = remaining == null ? List.of() : List.copyOf(remaining);
        inspectionErrors = inspectionErrors == null ? List.of() : List.copyOf(inspectionErrors);
    }
}
