package io.tombwatch.model;

import java.time.Instant;
import java.util.List;

public record ScenarioResult(
        String name,
        String title,
        List<String> faultNodes,
        List<NodeHandle> nodes,
        List<String> targetFiles,
        List<DeleteOutcome> deleteOutcomes,
        boolean tombstoneCreated,
        boolean partialFailureDetected,
        boolean autoCleanup,
        boolean residueFree,
        ScenarioStatus status,
        ScenarioPhase phaseReached,
        String failureReason,
        List<OrphanFile> orphans,
        List<ProtocolEvent> cleanupEvents,
        Long initialTotalFiles,
        Long finalTotalFiles,
        Instant startedAt,
        Instant endedAt,
        long durationMs
) {
    public ScenarioResult {
        faultNodes = faultNodes == null ? List.of() : List.copyOf(faultNodes);
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        targetFiles = targetFiles == null ? List.of() : List.copyOf(targetFiles);
        deleteOutcomes = deleteOutcomes == null ? List.of() : List.copyOf(deleteOutcomes);
        orphans = orphans == null ? List.of() : List.copyOf(orphans);
        cleanupEvents = cleanupEvents == null ? List.of() : List.copyOf(cleanupEvents);
    }

    public static ScenarioResult skipped(String name, String title, List<String> targetFiles, String reason, Instant at) {
        return new ScenarioResult(
                name,
                title,
                List.of(),
                List.of(),
                targetFiles,
                List.of(),
                false,
                false,
                false,
                false,
                ScenarioStatus.SKIPPED,
                ScenarioPhase.INIT,
                reason,
                List.of(),
                List.of(),
                null,
                null,
                at,
                at,
                0L
        );
    }

    public boolean passed() {
        return status == ScenarioStatus.PASSED;
    }

    public boolean verified() {
        return passed() && tombstoneCreated && autoCleanup;
    }

    public int degradedDeletes() {
        int count = 0;
        for (DeleteOutcome outcome : deleteOutcomes) {
            if (!outcome.accepted()) {
                count++;
            }
        }
        return count;
    }
}
