package io.tombwatch.scenario;

import io.tombwatch.cluster.ClusterQueryPort;
import io.tombwatch.cluster.ClusterUnavailableException;
import io.tombwatch.config.TombWatchSettings;
import io.tombwatch.model.DeleteOutcome;
import io.tombwatch.model.NodeHandle;
import io.tombwatch.model.NodeState;
import io.tombwatch.model.OrphanFile;
import io.tombwatch.model.ScenarioPhase;
import io.tombwatch.model.ScenarioResult;
import io.tombwatch.model.ScenarioStatus;
import io.tombwatch.observer.EventMarkers;
import io.tombwatch.observer.LogMarkerEventObserver;
import io.tombwatch.poller.ConvergencePoller;
import io.tombwatch.support.AdvancingSleeper;
import io.tombwatch.support.FakeCluster;
import io.tombwatch.support.ManualClock;
import io.tombwatch.support.RecordingLog;
import io.tombwatch.util.RunCancellation;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

final class ScenarioOrchestratorTest {
    private static final TombWatchSettings SETTINGS = TombWatchSettings.defaults();

    private final ManualClock clock = new ManualClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final AdvancingSleeper sleeper = new AdvancingSleeper(clock);
    private final RunCancellation cancellation = new RunCancellation();
    private final RecordingLog log = new RecordingLog();

    @Test
    void singleNodeRestartConvergesAndPasses() {
        FakeCluster cluster = seeded();

        ScenarioResult result = orchestrator(cluster).run(Scenarios.singleNodeRestart(SETTINGS));

        Assertions.assertEquals(ScenarioStatus.PASSED, result.status());
        Assertions.assertTrue(result.verified());
        Assertions.assertEquals(List.of("worker2"), result.faultNodes());
        Assertions.assertEquals(10, result.deleteOutcomes().size());
        Assertions.assertEquals("OK:2", result.deleteOutcomes().get(0).response());
        Assertions.assertTrue(result.tombstoneCreated());
        Assertions.assertFalse(result.partialFailureDetected());
        Assertions.assertTrue(result.autoCleanup());
        Assertions.assertTrue(result.residueFree());
        Assertions.assertEquals(10, result.cleanupEvents().size());
        Assertions.assertEquals(ScenarioPhase.DONE, result.phaseReached());
        Assertions.assertEquals(20L, result.initialTotalFiles());
        Assertions.assertEquals(10L, result.finalTotalFiles());
        Assertions.assertNull(result.failureReason());
        Assertions.assertEquals(List.of("stop worker2", "start worker2"), cluster.commands());
        Assertions.assertTrue(result.nodes().contains(new NodeHandle("worker2", NodeState.UP)));
        Assertions.assertEquals(result.endedAt().toEpochMilli() - result.startedAt().toEpochMilli(), result.durationMs());
        Assertions.assertTrue(log.actions().contains("scenario.done=passed"));
    }

    @Test
    void partialDeleteFailureIsDetectedWithTwoNodesDown() {
        FakeCluster cluster = seeded();

        ScenarioResult result = orchestrator(cluster).run(Scenarios.partialDeleteFailure(SETTINGS));

        Assertions.assertEquals(ScenarioStatus.PASSED, result.status());
        Assertions.assertEquals(List.of("worker1", "worker2"), result.faultNodes());
        Assertions.assertEquals("test_movie_0010.mp4", result.deleteOutcomes().get(0).file());
        Assertions.assertEquals("OK:1", result.deleteOutcomes().get(0).response());
        Assertions.assertTrue(result.partialFailureDetected());
        Assertions.assertTrue(result.tombstoneCreated());
        Assertions.assertTrue(result.verified());
        Assertions.assertEquals(
                List.of("stop worker1", "stop worker2", "start worker1", "start worker2"),
                cluster.commands()
        );
    }

    @Test
    void rejectedDeleteIsRecordedAndLeavesResidue() {
        FakeCluster cluster = seeded().respondTo("test_movie_0012.mp4", 500, "Internal Server Error");

        ScenarioResult result = orchestrator(cluster).run(Scenarios.partialDeleteFailure(SETTINGS));

        Assertions.assertEquals(10, result.deleteOutcomes().size());
        Assertions.assertEquals(1, result.degradedDeletes());
        Assertions.assertEquals(500, result.deleteOutcomes().get(2).status());
        Assertions.assertEquals(ScenarioStatus.FAILED, result.status());
        Assertions.assertFalse(result.autoCleanup());
        Assertions.assertEquals(3, result.orphans().size());
        for (OrphanFile orphan : result.orphans()) {
            Assertions.assertEquals("test_movie_0012.mp4", orphan.file());
        }
        Assertions.assertEquals("3 orphan file(s) remain", result.failureReason());
    }

    @Test
    void deletesFailingAtTheApiStillConvergeThroughTombstoneReplay() {
        FakeCluster cluster = seeded().answerAppliedDeletesWith(503, "Service Unavailable");

        ScenarioResult result = orchestrator(cluster).run(Scenarios.partialDeleteFailure(SETTINGS));

        Assertions.assertEquals(10, result.degradedDeletes());
        Assertions.assertEquals(503, result.deleteOutcomes().get(0).status());
        Assertions.assertTrue(result.partialFailureDetected());
        Assertions.assertTrue(result.tombstoneCreated());
        Assertions.assertTrue(result.autoCleanup());
        Assertions.assertEquals(ScenarioStatus.PASSED, result.status());
        Assertions.assertTrue(result.orphans().isEmpty());
        Assertions.assertTrue(result.verified());
    }

    @Test
    void stopFailureRestoresNodesAlreadyStopped() {
        FakeCluster cluster = seeded().failStop("worker2");

        ScenarioResult result = orchestrator(cluster).run(Scenarios.partialDeleteFailure(SETTINGS));

        Assertions.assertEquals(ScenarioStatus.FAILED, result.status());
        Assertions.assertEquals(ScenarioPhase.INIT, result.phaseReached());
        Assertions.assertTrue(result.failureReason().startsWith("stop worker2 failed"));
        Assertions.assertTrue(result.deleteOutcomes().isEmpty());
        Assertions.assertTrue(cluster.isUp("worker1"));
        Assertions.assertEquals(List.of("stop worker1", "stop worker2", "start worker1"), cluster.commands());
    }

    @Test
    void startFailureFailsScenarioWithoutConvergenceWait() {
        FakeCluster cluster = seeded().failStart("worker2");

        ScenarioResult result = orchestrator(cluster).run(Scenarios.singleNodeRestart(SETTINGS));

        Assertions.assertEquals(ScenarioStatus.FAILED, result.status());
        Assertions.assertEquals(ScenarioPhase.OPERATION_ISSUED, result.phaseReached());
        Assertions.assertTrue(result.failureReason().contains("start worker2 failed"));
        Assertions.assertTrue(result.nodes().contains(new NodeHandle("worker2", NodeState.UNKNOWN)));
        Assertions.assertFalse(log.actions().contains("convergence.poll=pending"));
    }

    @Test
    void residueFailsScenarioWhenCleanupNeverHappens() {
        FakeCluster cluster = seeded().disableAutoCleanup();

        ScenarioResult result = orchestrator(cluster).run(Scenarios.singleNodeRestart(SETTINGS));

        Assertions.assertEquals(ScenarioStatus.FAILED, result.status());
        Assertions.assertTrue(result.tombstoneCreated());
        Assertions.assertFalse(result.autoCleanup());
        Assertions.assertFalse(result.residueFree());
        Assertions.assertEquals(10, result.orphans().size());
        Assertions.assertEquals("worker2", result.orphans().get(0).node());
        Assertions.assertEquals("10 orphan file(s) remain", result.failureReason());
    }

    @Test
    void unreadableNodeMeansResidueCheckFails() {
        FakeCluster cluster = seeded().failListing("worker3");

        ScenarioResult result = orchestrator(cluster).run(Scenarios.singleNodeRestart(SETTINGS));

        Assertions.assertEquals(ScenarioStatus.FAILED, result.status());
        Assertions.assertTrue(result.orphans().isEmpty());
        Assertions.assertTrue(result.failureReason().startsWith("residue check incomplete"));
    }

    @Test
    void abortAfterFaultInjectionRestartsStoppedNode() {
        FakeCluster cluster = seeded();
        cluster.onStop(() -> cancellation.cancel("operator interrupt"));

        ScenarioResult result = orchestrator(cluster).run(Scenarios.singleNodeRestart(SETTINGS));

        Assertions.assertEquals(ScenarioStatus.FAILED, result.status());
        Assertions.assertEquals("aborted: operator interrupt", result.failureReason());
        Assertions.assertEquals(ScenarioPhase.FAULT_INJECTED, result.phaseReached());
        Assertions.assertTrue(result.deleteOutcomes().isEmpty());
        Assertions.assertTrue(cluster.isUp("worker2"));
        Assertions.assertEquals(List.of("stop worker2", "start worker2"), cluster.commands());
    }

    @Test
    void abortDuringDeletesSkipsLogInspection() {
        FakeCluster cluster = seeded();
        int[] sleeps = {0};
        sleeper.onSleep(() -> {
            if (++sleeps[0] == 3) {
                cancellation.cancel("operator interrupt");
            }
        });

        ScenarioResult result = orchestrator(cluster).run(Scenarios.singleNodeRestart(SETTINGS));

        Assertions.assertEquals("aborted: operator interrupt", result.failureReason());
        Assertions.assertEquals(ScenarioPhase.OPERATION_ISSUED, result.phaseReached());
        Assertions.assertEquals(2, result.deleteOutcomes().size());
        Assertions.assertFalse(result.tombstoneCreated());
        Assertions.assertFalse(log.logged("Step 4"));
        Assertions.assertTrue(cluster.isUp("worker2"));
        Assertions.assertEquals(List.of("stop worker2", "start worker2"), cluster.commands());
    }

    @Test
    void unexpectedErrorStillRestoresNodes() {
        FakeCluster cluster = seeded();
        ClusterQueryPort exploding = new ClusterQueryPort() {
            @Override
            public DeleteOutcome deleteFile(String name, String credential) {
                throw new IllegalStateException("boom");
            }

            @Override
            public Map<String, Long> getStats() throws ClusterUnavailableException {
                return cluster.getStats();
            }

            @Override
            public boolean health() {
                return true;
            }
        };
        LogMarkerEventObserver observer = new LogMarkerEventObserver(cluster, EventMarkers.defaults(), clock);
        ConvergencePoller poller = new ConvergencePoller(cluster, observer, sleeper, clock, cancellation, log);
        ScenarioOrchestrator orchestrator = new ScenarioOrchestrator(cluster, exploding, observer, poller, sleeper,
                clock, cancellation, log, SETTINGS.workers(), SETTINGS.coordinator(), SETTINGS.secret());

        ScenarioResult result = orchestrator.run(Scenarios.singleNodeRestart(SETTINGS));

        Assertions.assertEquals(ScenarioStatus.FAILED, result.status());
        Assertions.assertTrue(result.failureReason().contains("boom"));
        Assertions.assertTrue(cluster.isUp("worker2"));
    }

    @Test
    void statsOutageDoesNotStopScenario() {
        FakeCluster cluster = seeded().statsUnavailable();

        ScenarioResult result = orchestrator(cluster).run(Scenarios.singleNodeRestart(SETTINGS));

        Assertions.assertEquals(ScenarioStatus.PASSED, result.status());
        Assertions.assertNull(result.initialTotalFiles());
        Assertions.assertNull(result.finalTotalFiles());
    }

    private static FakeCluster seeded() {
        return FakeCluster.standard().seed(SETTINGS.targetFilePattern(), 20);
    }

    private ScenarioOrchestrator orchestrator(FakeCluster cluster) {
        LogMarkerEventObserver observer = new LogMarkerEventObserver(cluster, EventMarkers.defaults(), clock);
        ConvergencePoller poller = new ConvergencePoller(cluster, observer, sleeper, clock, cancellation, log);
        return new ScenarioOrchestrator(cluster, cluster, observer, poller, sleeper, clock, cancellation, log,
                SETTINGS.workers(), SETTINGS.coordinator(), SETTINGS.secret());
    }
}
