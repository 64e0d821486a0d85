package io.tombwatch.poller;

import io.tombwatch.cluster.ClusterControlPort;
import io.tombwatch.cluster.NodeInspectionException;
import io.tombwatch.model.EventKind;
import io.tombwatch.model.OrphanFile;
import io.tombwatch.model.ProtocolEvent;
import io.tombwatch.model.TargetFileSet;
import io.tombwatch.observability.HarnessLog;
import io.tombwatch.observer.EventObserver;
import io.tombwatch.util.RunCancellation;
import io.tombwatch.util.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Waits, for at most a fixed timeout, until no node lists any target file.
 *
 * <p>Each poll sleeps one interval, collects new auto-cleanup events from the log
 * sources, then lists every node. A failed listing counts as "not yet clean". The wait
 * is never extended here: a {@code false} result is final for this call.
 */
public final class ConvergencePoller {
    private final ClusterControlPort control;
    private final EventObserver observer;
    private final Sleeper sleeper;
    private final Clock clock;
    private final RunCancellation cancellation;
    private final HarnessLog log;

    public ConvergencePoller(
            ClusterControlPort control,
            EventObserver observer,
            Sleeper sleeper,
            Clock clock,
            RunCancellation cancellation,
            HarnessLog log
    ) {
        this.control = control;
        this.observer = observer;
        this.sleeper = sleeper;
        this.clock = clock;
        this.cancellation = cancellation == null ? new RunCancellation() : cancellation;
        this.log = log == null ? HarnessLog.silent() : log;
    }

    public ConvergenceOutcome awaitConvergence(
            List<String> nodeIds,
            TargetFileSet targets,
            Duration timeout,
            Duration pollInterval
    ) {
        return awaitConvergence(nodeIds, nodeIds, targets, timeout, pollInterval);
    }

    public ConvergenceOutcome awaitConvergence(
            List<String> nodeIds,
            List<String> logSources,
            TargetFileSet targets,
            Duration timeout,
            Duration pollInterval
    ) {
        Duration safeInterval = pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()
                ? Duration.ofSeconds(1)
                : pollInterval;
        long timeoutMs = timeout == null ? 0L : Math.max(0L, timeout.toMillis());
        long startedAtMs = clock.millis();
        List<ProtocolEvent> eventsSeen = new ArrayList<>();
        List<OrphanFile> remaining = List.of();
        List<String> inspectionErrors = List.of();
        int polls = 0;

        log.info("Waiting for cleanup (up to " + Duration.ofMillis(timeoutMs).toSeconds() + "s)");
        while (clock.millis() - startedAtMs < timeoutMs) {
            if (cancellation.isCancelled()) {
                return finish(false, eventsSeen, polls, startedAtMs, remaining, inspectionErrors, true);
            }
            try {
                sleeper.sleep(safeInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancellation.cancel("interrupted during convergence wait");
                return finish(false, eventsSeen, polls, startedAtMs, remaining, inspectionErrors, true);
            }
            polls++;

            for (String source : logSources) {
                for (ProtocolEvent event : observer.scan(source, EventKind.AUTO_CLEANUP, eventsSeen)) {
                    eventsSeen.add(event);
                    log.info("Found auto-cleanup event: " + source + " - " + abbreviate(event.rawLine()));
                }
            }

            List<OrphanFile> stillPresent = new ArrayList<>();
            List<String> errors = new ArrayList<>();
            for (String node : nodeIds) {
                try {
                    Set<String> files = control.listFiles(node);
                    for (String target : targets.files()) {
                        if (files.contains(target)) {
                            stillPresent.add(new OrphanFile(node, target));
                        }
                    }
                } catch (NodeInspectionException e) {
                    errors.add(e.getMessage());
                }
            }
            remaining = stillPresent;
            inspectionErrors = errors;
            log.record("convergence.poll", null, stillPresent.isEmpty() && errors.isEmpty() ? "clean" : "pending", Map.of(
                    "poll", polls,
                    "remaining", stillPresent.size(),
                    "inspection_errors", errors.size(),
                    "events_seen", eventsSeen.size()
            ));
            if (stillPresent.isEmpty() && errors.isEmpty()) {
                log.info("All target files cleaned up after " + polls + " poll(s)");
                return finish(true, eventsSeen, polls, startedAtMs, remaining, inspectionErrors, false);
            }
        }
        log.warn("Convergence timeout: " + remaining.size() + " target file(s) still present, "
                + inspectionErrors.size() + " node(s) not inspectable");
        return finish(false, eventsSeen, polls, startedAtMs, remaining, inspectionErrors, false);
    }

    private ConvergenceOutcome finish(
            boolean converged,
            List<ProtocolEvent> eventsSeen,
            int polls,
            long startedAtMs,
            List<OrphanFile> remaining,
            List<String> inspectionErrors,
            boolean cancelled
    ) {
        return new ConvergenceOutcome(
                converged,
                eventsSeen,
                polls,
                Math.max(0L, clock.millis() - startedAtMs),
                remaining,
                inspectionErrors,
                cancelled
        );
    }

    private static String abbreviate(String raw) {
        return raw.length() <= 100 ? raw : raw.substring(0, 100);
    }
}
