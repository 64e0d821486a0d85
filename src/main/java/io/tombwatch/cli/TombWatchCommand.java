package io.tombwatch.cli;

import io.tombwatch.cluster.ClusterUnavailableException;
import io.tombwatch.config.TombWatchSettings;
import io.tombwatch.harness.TombstoneHarness;
import io.tombwatch.model.EventKind;
import io.tombwatch.model.PreconditionResult;
import io.tombwatch.model.ProtocolEvent;
import io.tombwatch.model.TargetFileSet;
import io.tombwatch.observability.HarnessLog;
import io.tombwatch.observability.RunJournal;
import io.tombwatch.report.ReportWriter;
import io.tombwatch.scenario.ScenarioDefinition;
import io.tombwatch.scenario.Scenarios;
import io.tombwatch.util.Jsons;
import io.tombwatch.util.RunCancellation;
import io.tombwatch.verify.VerificationOutcome;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(
        name = "tombwatch",
        mixinStandardHelpOptions = true,
        description = "Fault-injection harness for tombstone (deferred delete) convergence",
        subcommands = {
                TombWatchCommand.RunCommand.class,
                TombWatchCommand.VerifyCommand.class,
                TombWatchCommand.CheckEnvCommand.class,
                TombWatchCommand.EventsCommand.class,
                TombWatchCommand.StatsCommand.class
        }
)
public final class TombWatchCommand implements Runnable {
    private static final DateTimeFormatter RUN_ID = DateTimeFormatter.ofPattern("'run-'yyyyMMdd-HHmmss");

    @Option(names = {"--settings"}, description = "Settings file (default: ./tombwatch-settings.json when present)")
    String settingsPath;

    @Option(names = {"--master-url"}, description = "Coordinator base URL, overrides settings")
    String masterUrl;

    @Option(names = {"--secret"}, description = "Delete credential, overrides settings")
    String secret;

    @Option(names = {"--out"}, description = "Output directory for logs and reports, overrides settings")
    String out;

    @Override
    public void run() {
        System.out.println("Use subcommands: run | verify | check-env | events | stats");
    }

    TombWatchSettings settings() {
        return TombWatchSettings.load(settingsPath).withOverrides(masterUrl, secret, out);
    }

    static String newRunId() {
        return RUN_ID.format(LocalDateTime.now());
    }

    @Command(name = "run", description = "Run fault-injection scenarios, verify, and write reports")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        TombWatchCommand parent;

        @Option(names = {"--scenario"}, defaultValue = Scenarios.ALL,
                description = "all | single-node-restart | partial-delete-failure")
        String scenario;

        @Override
        public Integer call() {
            TombWatchSettings settings;
            List<ScenarioDefinition> selected;
            try {
                settings = parent.settings();
                selected = Scenarios.select(scenario, settings);
            } catch (IllegalArgumentException e) {
                System.err.println(e.getMessage());
                return TombstoneHarness.EXIT_PRECONDITION;
            }
            String runId = newRunId();
            RunJournal journal = RunJournal.open(settings.outputPath(), runId, settings.secret());
            RunCancellation cancellation = new RunCancellation();
            TombstoneHarness harness = TombstoneHarness.create(settings, journal, cancellation);
            Thread hook = harness.shutdownHook();
            Runtime.getRuntime().addShutdownHook(hook);
            TombstoneHarness.RunOutcome outcome = harness.run(selected, runId);
            if (!cancellation.isCancelled()) {
                Runtime.getRuntime().removeShutdownHook(hook);
            }
            return outcome.exitCode();
        }
    }

    @Command(name = "verify", description = "Check the current cluster state for tombstone residue")
    static final class VerifyCommand implements Callable<Integer> {
        @ParentCommand
        TombWatchCommand parent;

        @Option(names = {"--test-files"}, split = ",",
                description = "Comma-separated file names to check (default: every scenario target)")
        List<String> testFiles;

        @Option(names = {"--output"}, description = "Markdown report path (default: <out>/verification_report.md)")
        String output;

        @Override
        public Integer call() {
            TombWatchSettings settings;
            try {
                settings = parent.settings();
            } catch (IllegalArgumentException e) {
                System.err.println(e.getMessage());
                return TombstoneHarness.EXIT_PRECONDITION;
            }
            TargetFileSet targets = testFiles == null || testFiles.isEmpty()
                    ? Scenarios.allTargets(settings)
                    : new TargetFileSet(testFiles);
            RunJournal journal = RunJournal.open(settings.outputPath(), newRunId(), settings.secret());
            TombstoneHarness harness = TombstoneHarness.create(settings, journal, new RunCancellation());
            VerificationOutcome outcome = harness.verify(targets);
            Path target = output == null || output.isBlank() ? null : Paths.get(output.trim());
            ReportWriter.Artifacts artifacts = harness.writer().writeVerification(outcome, targets.size(), target);
            journal.info("Verification report: " + artifacts.markdown());
            return outcome.passed() ? TombstoneHarness.EXIT_PASS : TombstoneHarness.EXIT_FAIL;
        }
    }

    @Command(name = "check-env", description = "Check containers, coordinator health and indexed file count")
    static final class CheckEnvCommand implements Callable<Integer> {
        @ParentCommand
        TombWatchCommand parent;

        @Override
        public Integer call() {
            TombWatchSettings settings;
            try {
                settings = parent.settings();
            } catch (IllegalArgumentException e) {
                System.err.println(e.getMessage());
                return TombstoneHarness.EXIT_PRECONDITION;
            }
            TombstoneHarness harness = TombstoneHarness.create(settings, HarnessLog.silent(), new RunCancellation());
            PreconditionResult result = harness.checkEnvironment();
            System.out.println(Jsons.toJson(result));
            return result.ok() ? TombstoneHarness.EXIT_PASS : TombstoneHarness.EXIT_PRECONDITION;
        }
    }

    @Command(name = "events", description = "List protocol events found in one node's logs")
    static final class EventsCommand implements Callable<Integer> {
        @ParentCommand
        TombWatchCommand parent;

        @Option(names = {"--node"}, required = true, description = "Node id, e.g. master or worker2")
        String node;

        @Option(names = {"--kind"}, description = "tombstone-created | partial-delete-failure | auto-cleanup")
        String kind;

        @Override
        public Integer call() {
            TombWatchSettings settings;
            Set<EventKind> kinds;
            try {
                settings = parent.settings();
                kinds = kind == null || kind.isBlank() ? EnumSet.allOf(EventKind.class) : EnumSet.of(EventKind.fromString(kind));
            } catch (IllegalArgumentException e) {
                System.err.println(e.getMessage());
                return TombstoneHarness.EXIT_PRECONDITION;
            }
            TombstoneHarness harness = TombstoneHarness.create(settings, HarnessLog.silent(), new RunCancellation());
            Collection<ProtocolEvent> events = harness.observer().scan(node, kinds, List.of());
            for (ProtocolEvent event : events) {
                System.out.println(Jsons.toCompactJson(event));
            }
            return 0;
        }
    }

    @Command(name = "stats", description = "Print coordinator statistics")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        TombWatchCommand parent;

        @Override
        public Integer call() {
            TombWatchSettings settings;
            try {
                settings = parent.settings();
            } catch (IllegalArgumentException e) {
                System.err.println(e.getMessage());
                return TombstoneHarness.EXIT_PRECONDITION;
            }
            TombstoneHarness harness = TombstoneHarness.create(settings, HarnessLog.silent(), new RunCancellation());
            try {
                Map<String, Object> out = new LinkedHashMap<>(harness.query().getStats());
                out.put("master_url", settings.masterUrl());
                System.out.println(Jsons.toJson(out));
                return 0;
            } catch (ClusterUnavailableException e) {
                System.err.println("Coordinator unavailable: " + e.getMessage());
                return TombstoneHarness.EXIT_FAIL;
            }
        }
    }
}
