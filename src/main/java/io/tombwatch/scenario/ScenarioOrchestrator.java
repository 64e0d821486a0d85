package io.tombwatch.scenario;

import io.tombwatch.cluster.ClusterControlPort;
import io.tombwatch.cluster.ClusterQueryPort;
import io.tombwatch.cluster.ClusterUnavailableException;
import io.tombwatch.cluster.ControlOutcome;
import io.tombwatch.cluster.NodeInspectionException;
import io.tombwatch.model.DeleteOutcome;
import io.tombwatch.model.EventKind;
import io.tombwatch.model.NodeState;
import io.tombwatch.model.OrphanFile;
import io.tombwatch.model.ProtocolEvent;
import io.tombwatch.model.ScenarioPhase;
import io.tombwatch.model.ScenarioResult;
import io.tombwatch.model.ScenarioStatus;
import io.tombwatch.observability.HarnessLog;
import io.tombwatch.observer.EventObserver;
import io.tombwatch.poller.ConvergenceOutcome;
import io.tombwatch.poller.ConvergencePoller;
import io.tombwatch.util.RunCancellation;
import io.tombwatch.util.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Runs one scenario through
 * {@code INIT -> FAULT_INJECTED -> OPERATION_ISSUED -> FAULT_RECOVERED -> CONVERGING -> DONE}.
 *
 * <p>A scenario passes only when the final residue check finds no target file on any
 * node. The poller's verdict, the tombstone marker and the per-delete HTTP status are
 * recorded but do not decide {@code status}. Node-control failures end the scenario
 * immediately; nodes this scenario already stopped are restarted on a best-effort
 * basis before returning so the next scenario starts from a full cluster.
 */
public final class ScenarioOrchestrator {
    private final ClusterControlPort control;
    private final ClusterQueryPort query;
    private final EventObserver observer;
    private final ConvergencePoller poller;
    private final Sleeper sleeper;
    private final Clock clock;
    private final RunCancellation cancellation;
    private final HarnessLog log;
    private final List<String> workers;
    private final String coordinator;
    private final List<String> logSources;
    private final String credential;

    public ScenarioOrchestrator(
            ClusterControlPort control,
            ClusterQueryPort query,
            EventObserver observer,
            ConvergencePoller poller,
            Sleeper sleeper,
            Clock clock,
            RunCancellation cancellation,
            HarnessLog log,
            List<String> workers,
            String coordinator,
            String credential
    ) {
        if (workers == null || workers.isEmpty()) {
            throw new IllegalArgumentException("orchestrator needs at least one worker");
        }
        this.control = control;
        this.query = query;
        this.observer = observer;
        this.poller = poller;
        this.sleeper = sleeper;
        this.clock = clock;
        this.cancellation = cancellation;
        this.log = log;
        this.workers = List.copyOf(workers);
        this.coordinator = coordinator;
        List<String> sources = new ArrayList<>(workers);
        if (coordinator != null && !sources.contains(coordinator)) {
            sources.add(coordinator);
        }
        this.logSources = List.copyOf(sources);
        this.credential = credential;
    }

    public ScenarioResult run(ScenarioDefinition definition) {
        ScenarioRun run = new ScenarioRun(definition, workers, clock.instant());
        try {
            return execute(definition, run);
        } catch (RuntimeException e) {
            log.error("Scenario " + definition.name() + " raised " + e.getClass().getSimpleName() + ": " + e.getMessage());
            return failControl(run, "unexpected error in " + run.phase + ": " + e.getMessage());
        }
    }

    private ScenarioResult execute(ScenarioDefinition definition, ScenarioRun run) {
        log.info("=".repeat(60));
        log.info("Scenario " + definition.name() + ": " + definition.title());
        log.info("=".repeat(60));
        log.record("scenario.start", null, "ok", Map.of(
                "scenario", definition.name(),
                "fault_nodes", definition.faultNodes(),
                "targets", definition.targets().size()
        ));

        // INIT
        log.info("Step 1: record baseline");
        run.initialTotalFiles = snapshotTotalFiles("baseline");

        // INIT -> FAULT_INJECTED
        if (cancellation.isCancelled()) {
            return abort(run);
        }
        log.info("Step 2: stop " + String.join(", ", definition.faultNodes()));
        for (String node : definition.faultNodes()) {
            ControlOutcome stopped = control.stop(node);
            log.record("node.stop", node, stopped.ok() ? "ok" : "failed", Map.of("message", nullToEmpty(stopped.message())));
            if (!stopped.ok()) {
                run.mark(node, NodeState.UNKNOWN);
                log.error("Failed to stop " + node + ": " + stopped.message());
                return failControl(run, "stop " + node + " failed: " + stopped.message());
            }
            run.mark(node, NodeState.DOWN);
            run.stoppedNodes.add(node);
            log.info("  " + node + " stopped");
        }
        run.phase = ScenarioPhase.FAULT_INJECTED;
        if (!pause(definition.settleAfterStop())) {
            return abort(run);
        }

        // FAULT_INJECTED -> OPERATION_ISSUED
        if (cancellation.isCancelled()) {
            return abort(run);
        }
        log.info("Step 3: delete " + definition.targets().size() + " file(s) with "
                + String.join(", ", definition.faultNodes()) + " down");
        List<String> files = definition.targets().files();
        for (int i = 0; i < files.size(); i++) {
            DeleteOutcome outcome = query.deleteFile(files.get(i), credential);
            run.deleteOutcomes.add(outcome);
            log.info("  " + (outcome.accepted() ? "OK  " : "FAIL") + " " + outcome.file() + ": " + outcome.detail());
            log.record("file.delete", null, String.valueOf(outcome.status()), Map.of(
                    "scenario", definition.name(),
                    "file", outcome.file(),
                    "detail", outcome.detail()
            ));
            if (i + 1 < files.size() && !pause(definition.deleteSpacing())) {
                break;
            }
        }
        run.phase = ScenarioPhase.OPERATION_ISSUED;
        if (cancellation.isCancelled()) {
            return abort(run);
        }

        log.info("Step 4: inspect " + coordinator + " logs for tombstone markers");
        Set<EventKind> kinds = definition.checkPartialFailure()
                ? EnumSet.of(EventKind.TOMBSTONE_CREATED, EventKind.PARTIAL_DELETE_FAILURE)
                : EnumSet.of(EventKind.TOMBSTONE_CREATED);
        Collection<ProtocolEvent> markers = observer.scan(coordinator, kinds, List.of());
        run.tombstoneCreated = containsKind(markers, EventKind.TOMBSTONE_CREATED);
        run.partialFailureDetected = containsKind(markers, EventKind.PARTIAL_DELETE_FAILURE);
        if (definition.checkPartialFailure()) {
            log.info("  partial delete failure detected: " + yesNo(run.partialFailureDetected));
        }
        log.info("  tombstone created: " + yesNo(run.tombstoneCreated));

        // OPERATION_ISSUED -> FAULT_RECOVERED
        if (cancellation.isCancelled()) {
            return abort(run);
        }
        log.info("Step 5: restart " + String.join(", ", definition.faultNodes()));
        if (!restartStopped(run)) {
            return finish(run, ScenarioStatus.FAILED);
        }
        run.phase = ScenarioPhase.FAULT_RECOVERED;
        if (!pause(definition.settleAfterStart())) {
            return abort(run);
        }

        // FAULT_RECOVERED -> CONVERGING
        if (cancellation.isCancelled()) {
            return abort(run);
        }
        log.info("Step 6: wait for automatic cleanup");
        run.phase = ScenarioPhase.CONVERGING;
        ConvergenceOutcome convergence = poller.awaitConvergence(
                workers,
                logSources,
                definition.targets(),
                definition.convergenceTimeout(),
                definition.pollInterval()
        );
        run.autoCleanup = convergence.converged();
        run.cleanupEvents.addAll(convergence.eventsSeen());
        if (convergence.cancelled()) {
            return abort(run);
        }

        // CONVERGING -> DONE
        log.info("Step 7: residue check on every node");
        run.residueFree = residueCheck(run);
        run.finalTotalFiles = snapshotTotalFiles("final");
        if (!run.residueFree && run.failureReason == null) {
            run.failureReason = run.orphans.size() + " orphan file(s) remain";
        }
        run.phase = ScenarioPhase.DONE;
        return finish(run, run.residueFree ? ScenarioStatus.PASSED : ScenarioStatus.FAILED);
    }

    private boolean residueCheck(ScenarioRun run) {
        boolean clean = true;
        for (String node : workers) {
            try {
                Set<String> present = control.listFiles(node);
                List<String> found = new ArrayList<>();
                for (String target : run.definition.targets().files()) {
                    if (present.contains(target)) {
                        found.add(target);
                        run.orphans.add(new OrphanFile(node, target));
                    }
                }
                if (found.isEmpty()) {
                    log.info("  " + node + ": no residue");
                } else {
                    clean = false;
                    log.error("  " + node + ": residual files " + found);
                }
            } catch (NodeInspectionException e) {
                clean = false;
                run.failureReason = "residue check incomplete: " + e.getMessage();
                log.error("  " + node + ": listing failed: " + e.getMessage());
            }
        }
        return clean;
    }

    private boolean restartStopped(ScenarioRun run) {
        List<String> pending = new ArrayList<>(run.stoppedNodes);
        for (String node : pending) {
            ControlOutcome started = control.start(node);
            log.record("node.start", node, started.ok() ? "ok" : "failed", Map.of("message", nullToEmpty(started.message())));
            if (!started.ok()) {
                run.mark(node, NodeState.UNKNOWN);
                log.error("Failed to start " + node + ": " + started.message());
                if (run.failureReason == null) {
                    run.failureReason = "start " + node + " failed: " + started.message();
                }
                return false;
            }
            run.mark(node, NodeState.UP);
            run.stoppedNodes.remove(node);
            log.info("  " + node + " started");
        }
        return true;
    }

    private ScenarioResult failControl(ScenarioRun run, String reason) {
        run.failureReason = reason;
        if (!run.stoppedNodes.isEmpty()) {
            log.warn("Restoring nodes stopped by this scenario: " + run.stoppedNodes);
            restartStopped(run);
        }
        return finish(run, ScenarioStatus.FAILED);
    }

    private ScenarioResult abort(ScenarioRun run) {
        String why = cancellation.reason();
        run.failureReason = "aborted" + (why == null || why.isBlank() ? "" : ": " + why);
        log.warn("Scenario " + run.definition.name() + " aborted during " + run.phase);
        if (!run.stoppedNodes.isEmpty()) {
            log.warn("Restoring nodes stopped by this scenario: " + run.stoppedNodes);
            // node commands wait on child processes; run them with the interrupt flag cleared
            boolean interrupted = Thread.interrupted();
            try {
                restartStopped(run);
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        return finish(run, ScenarioStatus.FAILED);
    }

    private ScenarioResult finish(ScenarioRun run, ScenarioStatus status) {
        ScenarioPhase reached = run.phase;
        ScenarioResult result = run.freeze(status, clock.instant());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("scenario", result.name());
        details.put("phase_reached", reached.name());
        details.put("tombstone_created", result.tombstoneCreated());
        details.put("partial_failure_detected", result.partialFailureDetected());
        details.put("auto_cleanup", result.autoCleanup());
        details.put("residue_free", result.residueFree());
        details.put("orphans", result.orphans().size());
        details.put("duration_ms", result.durationMs());
        details.put("reason", nullToEmpty(result.failureReason()));
        log.record("scenario.done", null, status.label(), details);
        log.info("Scenario " + result.name() + " finished in "
                + String.format(Locale.ROOT, "%.1f", result.durationMs() / 1000.0) + "s: " + status.label()
                + (result.failureReason() == null ? "" : " (" + result.failureReason() + ")"));
        return result;
    }

    private Long snapshotTotalFiles(String label) {
        try {
            Map<String, Long> stats = query.getStats();
            Long total = stats.get(ClusterQueryPort.TOTAL_FILES);
            log.info("  " + label + " total_files=" + total + " active_nodes=" + stats.get(ClusterQueryPort.ACTIVE_NODES));
            return total;
        } catch (ClusterUnavailableException e) {
            log.warn("  " + label + " stats unavailable: " + e.getMessage());
            return null;
        }
    }

    private boolean pause(Duration duration) {
        if (duration.isZero()) {
            return true;
        }
        try {
            sleeper.sleep(duration);
            return !cancellation.isCancelled();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel("interrupted");
            return false;
        }
    }

    private static boolean containsKind(Collection<ProtocolEvent> events, EventKind kind) {
        for (ProtocolEvent event : events) {
            if (event.kind() == kind) {
                return true;
            }
        }
        return false;
    }

    private static String yesNo(boolean value) {
        return value ? "yes" : "no";
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
