package io.tombwatch.harness;

import io.tombwatch.cluster.ClusterControlPort;
import io.tombwatch.cluster.ClusterQueryPort;
import io.tombwatch.cluster.ComposeClusterControl;
import io.tombwatch.cluster.HttpClusterQuery;
import io.tombwatch.config.TombWatchSettings;
import io.tombwatch.model.CheckResult;
import io.tombwatch.model.PreconditionResult;
import io.tombwatch.model.Report;
import io.tombwatch.model.ScenarioResult;
import io.tombwatch.model.TargetFileSet;
import io.tombwatch.observability.HarnessLog;
import io.tombwatch.observer.EventMarkers;
import io.tombwatch.observer.EventObserver;
import io.tombwatch.observer.LogMarkerEventObserver;
import io.tombwatch.poller.ConvergencePoller;
import io.tombwatch.report.ReportWriter;
import io.tombwatch.scenario.ScenarioDefinition;
import io.tombwatch.scenario.ScenarioOrchestrator;
import io.tombwatch.util.RunCancellation;
import io.tombwatch.util.Sleeper;
import io.tombwatch.verify.VerificationAggregator;
import io.tombwatch.verify.VerificationContext;
import io.tombwatch.verify.VerificationOutcome;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class TombstoneHarness {
    public static final int EXIT_PASS = 0;
    public static final int EXIT_FAIL = 1;
    public static final int EXIT_PRECONDITION = 2;
    public static final int EXIT_ABORTED = 130;

    private final TombWatchSettings settings;
    private final ClusterControlPort control;
    private final ClusterQueryPort query;
    private final EventObserver observer;
    private final Sleeper sleeper;
    private final Clock clock;
    private final RunCancellation cancellation;
    private final HarnessLog log;
    private final ReportWriter writer;
    private final CountDownLatch finished = new CountDownLatch(1);

    public TombstoneHarness(
            TombWatchSettings settings,
            ClusterControlPort control,
            ClusterQueryPort query,
            Sleeper sleeper,
            Clock clock,
            RunCancellation cancellation,
            HarnessLog log,
            ReportWriter writer
    ) {
        this.settings = settings;
        this.control = control;
        this.query = query;
        this.observer = new LogMarkerEventObserver(control, EventMarkers.from(settings), clock);
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.clock = clock;
        this.cancellation = cancellation == null ? new RunCancellation() : cancellation;
        this.log = log == null ? HarnessLog.silent() : log;
        this.writer = writer;
    }

    public static TombstoneHarness create(TombWatchSettings settings, HarnessLog log, RunCancellation cancellation) {
        Clock clock = Clock.systemDefaultZone();
        return new TombstoneHarness(
                settings,
                new ComposeClusterControl(settings),
                new HttpClusterQuery(settings.masterUrl(), settings.httpTimeoutMs(), clock),
                Sleeper.SYSTEM,
                clock,
                cancellation,
                log,
                new ReportWriter(settings.outputPath(), settings.secret(), clock.getZone())
        );
    }

    public PreconditionResult checkEnvironment() {
        return new EnvironmentCheck(control, query, log, settings.minFileCount()).evaluate();
    }

    public RunOutcome run(List<ScenarioDefinition> scenarios, String runId) {
        try {
            return runInternal(scenarios, runId);
        } finally {
            finished.countDown();
        }
    }

    private RunOutcome runInternal(List<ScenarioDefinition> scenarios, String runId) {
        Instant startedAt = clock.instant();
        log.info("=".repeat(60));
        log.info("Tombstone verification run " + runId);
        log.info("=".repeat(60));
        log.record("run.start", null, "ok", Map.of(
                "master_url", settings.masterUrl(),
                "scenarios", scenarioNames(scenarios)
        ));

        PreconditionResult precondition = checkEnvironment();
        if (!precondition.ok()) {
            log.error("Environment precondition failed: " + precondition.summary());
            Report report = new Report(runId, settings.masterUrl(), clock.instant(), startedAt, clock.instant(),
                    precondition, List.of(), Map.of(), false);
            return complete(report, EXIT_PRECONDITION);
        }

        ScenarioOrchestrator orchestrator = orchestrator();
        List<ScenarioResult> results = new ArrayList<>();
        List<String> allTargets = new ArrayList<>();
        for (int i = 0; i < scenarios.size(); i++) {
            ScenarioDefinition definition = scenarios.get(i);
            allTargets.addAll(definition.targets().files());
            if (cancellation.isCancelled()) {
                results.add(ScenarioResult.skipped(definition.name(), definition.title(),
                        definition.targets().files(), "skipped: run aborted", clock.instant()));
                continue;
            }
            results.add(orchestrator.run(definition));
            if (i + 1 < scenarios.size() && !cancellation.isCancelled()) {
                log.info("Waiting " + settings.interScenarioPauseMs() + "ms before next scenario");
                pause(Duration.ofMillis(settings.interScenarioPauseMs()));
            }
        }

        Map<String, CheckResult> checks = Map.of();
        if (cancellation.isCancelled()) {
            log.warn("Run aborted (" + cancellation.reason() + "); skipping verification");
        } else {
            checks = verify(new TargetFileSet(allTargets)).checks();
        }

        boolean aborted = cancellation.isCancelled();
        Report report = new Report(runId, settings.masterUrl(), clock.instant(), startedAt, clock.instant(),
                precondition, results, checks, aborted);
        int exitCode = aborted ? EXIT_ABORTED : report.overallPassed() ? EXIT_PASS : EXIT_FAIL;
        return complete(report, exitCode);
    }

    public VerificationOutcome verify(TargetFileSet targets) {
        VerificationContext context = new VerificationContext(control, query, observer,
                settings.workers(), settings.coordinator(), targets);
        return VerificationAggregator.standard(log, clock).verify(context);
    }

    public Thread shutdownHook() {
        long graceMs = Math.max(10_000L, settings.commandTimeoutMs() * 3);
        return new Thread(() -> {
            if (finished.getCount() == 0) {
                return;
            }
            cancellation.cancel("operator interrupt");
            log.warn("Interrupt received; restoring nodes and writing partial report");
            try {
                finished.await(graceMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "tombwatch-shutdown");
    }

    public EventObserver observer() {
        return observer;
    }

    public ClusterQueryPort query() {
        return query;
    }

    public ReportWriter writer() {
        return writer;
    }

    ScenarioOrchestrator orchestrator() {
        ConvergencePoller poller = new ConvergencePoller(control, observer, sleeper, clock, cancellation, log);
        return new ScenarioOrchestrator(control, query, observer, poller, sleeper, clock, cancellation, log,
                settings.workers(), settings.coordinator(), settings.secret());
    }

    private RunOutcome complete(Report report, int exitCode) {
        ReportWriter.Artifacts artifacts = writer.write(report);
        log.info("Report: " + artifacts.markdown());
        log.info("Results: " + artifacts.json());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("exit_code", exitCode);
        details.put("overall_passed", report.overallPassed());
        details.put("aborted", report.aborted());
        details.put("report", artifacts.markdown().toString());
        log.record("run.done", null, exitCode == EXIT_PASS ? "ok" : "failed", details);
        log.info(exitLine(exitCode));
        return new RunOutcome(report, artifacts, exitCode);
    }

    private void pause(Duration duration) {
        if (duration.isZero()) {
            return;
        }
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel("interrupted");
        }
    }

    private static List<String> scenarioNames(List<ScenarioDefinition> scenarios) {
        List<String> names = new ArrayList<>();
        for (ScenarioDefinition definition : scenarios) {
            names.add(definition.name());
        }
        return names;
    }

    private static String exitLine(int exitCode) {
        return switch (exitCode) {
            case EXIT_PASS -> "Tombstone mechanism verified: PASS";
            case EXIT_PRECONDITION -> "Environment not ready: run skipped";
            case EXIT_ABORTED -> "Run aborted: partial report written";
            default -> "Tombstone mechanism verification: FAIL";
        };
    }

    public record RunOutcome(Report report, ReportWriter.Artifacts artifacts, int exitCode) {
    }
}
