package io.tombwatch.scenario;

import io.tombwatch.model.DeleteOutcome;
import io.tombwatch.model.NodeHandle;
import io.tombwatch.model.NodeState;
import io.tombwatch.model.OrphanFile;
import io.tombwatch.model.ProtocolEvent;
import io.tombwatch.model.ScenarioPhase;
import io.tombwatch.model.ScenarioResult;
import io.tombwatch.model.ScenarioStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ScenarioRun {
    final ScenarioDefinition definition;
    final Instant startedAt;
    final Map<String, NodeHandle> nodes = new LinkedHashMap<>();
    final List<String> stoppedNodes = new ArrayList<>();
    final List<DeleteOutcome> deleteOutcomes = new ArrayList<>();
    final List<ProtocolEvent> cleanupEvents = new ArrayList<>();
    final List<OrphanFile> orphans = new ArrayList<>();
    ScenarioPhase phase = ScenarioPhase.INIT;
    boolean tombstoneCreated;
    boolean partialFailureDetected;
    boolean autoCleanup;
    boolean residueFree;
    String failureReason;
    Long initialTotalFiles;
    Long finalTotalFiles;

    ScenarioRun(ScenarioDefinition definition, List<String> clusterNodes, Instant startedAt) {
        this.definition = definition;
        this.startedAt = startedAt;
        for (String node : clusterNodes) {
            nodes.put(node, NodeHandle.unknown(node));
        }
        for (String node : definition.faultNodes()) {
            nodes.putIfAbsent(node, NodeHandle.unknown(node));
        }
    }

    void mark(String node, NodeState state) {
        nodes.put(node, new NodeHandle(node, state));
    }

    ScenarioResult freeze(ScenarioStatus status, Instant endedAt) {
        return new ScenarioResult(
                definition.name(),
                definition.title(),
                definition.faultNodes(),
                List.copyOf(nodes.values()),
                definition.targets().files(),
                deleteOutcomes,
                tombstoneCreated,
                partialFailureDetected,
                autoCleanup,
                residueFree,
                status,
                phase,
                failureReason,
                orphans,
                cleanupEvents,
                initialTotalFiles,
                finalTotalFiles,
                startedAt,
                endedAt,
                Math.max(0L, endedAt.toEpochMilli() - startedAt.toEpochMilli())
        );
    }
}
