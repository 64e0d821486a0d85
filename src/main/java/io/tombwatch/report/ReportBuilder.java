package io.tombwatch.report;

import io.tombwatch.model.CheckResult;
import io.tombwatch.model.DeleteOutcome;
import io.tombwatch.model.NodeHandle;
import io.tombwatch.model.OrphanFile;
import io.tombwatch.model.PreconditionResult;
import io.tombwatch.model.ProtocolEvent;
import io.tombwatch.model.Report;
import io.tombwatch.model.ScenarioResult;
import io.tombwatch.model.TargetFileSet;
import io.tombwatch.util.Jsons;
import io.tombwatch.verify.VerificationOutcome;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class ReportBuilder {
    static final int RESPONSE_COLUMN_CHARS = 50;
    private static final String NL = "\n";

    private ReportBuilder() {
    }

    public static String markdown(Report report) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Tombstone Verification Report").append(NL).append(NL);
        sb.append("**Generated**: ").append(report.generatedAt()).append(NL).append(NL);

        sb.append("## Overview").append(NL).append(NL);
        bullet(sb, "Run id", report.runId());
        bullet(sb, "Started", String.valueOf(report.startedAt()));
        bullet(sb, "Finished", report.endedAt() == null ? "not finished" : report.endedAt().toString());
        bullet(sb, "Total duration", report.endedAt() == null || report.startedAt() == null
                ? "not finished"
                : seconds(Duration.between(report.startedAt(), report.endedAt()).toMillis()));
        bullet(sb, "Target files", String.valueOf(report.targetFileCount()));
        bullet(sb, "Coordinator URL", report.masterUrl());
        bullet(sb, "Precondition", preconditionLine(report.precondition()));
        if (report.aborted()) {
            bullet(sb, "Aborted", "yes (partial report)");
        }
        sb.append(NL);

        int index = 1;
        for (ScenarioResult scenario : report.scenarios()) {
            appendScenario(sb, index++, scenario);
        }

        if (!report.checks().isEmpty()) {
            sb.append("## Verification").append(NL).append(NL);
            appendChecks(sb, report.checks());
        }

        sb.append("## Summary").append(NL).append(NL);
        sb.append("| Item | Result |").append(NL);
        sb.append("|------|--------|").append(NL);
        for (ScenarioResult scenario : report.scenarios()) {
            sb.append("| scenario ").append(cell(scenario.name())).append(" | ")
                    .append(scenario.verified() ? "PASS" : "FAIL").append(" |").append(NL);
        }
        for (CheckResult check : report.checks().values()) {
            sb.append("| check ").append(cell(check.name())).append(" | ")
                    .append(check.passed() ? "PASS" : "FAIL").append(" |").append(NL);
        }
        sb.append("| **overall** | ").append(report.overallPassed() ? "**PASS**" : "**FAIL**").append(" |").append(NL);
        sb.append(NL);

        appendConclusion(sb, report);
        return sb.toString();
    }

    public static String json(Report report) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("run_id", report.runId());
        root.put("generated_at", String.valueOf(report.generatedAt()));
        root.put("master_url", report.masterUrl());
        root.put("started_at", String.valueOf(report.startedAt()));
        root.put("ended_at", report.endedAt() == null ? null : report.endedAt().toString());
        root.put("aborted", report.aborted());
        root.put("precondition", preconditionJson(report.precondition()));
        List<Map<String, Object>> scenarios = new ArrayList<>();
        for (ScenarioResult scenario : report.scenarios()) {
            scenarios.add(scenarioJson(scenario));
        }
        root.put("scenarios", scenarios);
        root.put("checks", checksJson(report.checks()));
        Map<String, Object> overall = new LinkedHashMap<>();
        overall.put("all_passed", report.overallPassed());
        overall.put("scenarios_verified", countVerified(report.scenarios()));
        overall.put("scenarios_total", report.scenarios().size());
        overall.put("checks_passed", countPassed(report.checks()));
        overall.put("checks_total", report.checks().size());
        root.put("overall", overall);
        return Jsons.toJson(root) + NL;
    }

    public static String verificationMarkdown(VerificationOutcome outcome, int targetCount) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Tombstone Verification").append(NL).append(NL);
        sb.append("**Verified at**: ").append(outcome.verifiedAt()).append(NL).append(NL);
        sb.append("### Overall: ").append(outcome.passed() ? "PASS" : "FAIL").append(NL).append(NL);
        sb.append("- Checks passed: ").append(outcome.passedCount()).append('/').append(outcome.checks().size()).append(NL);
        sb.append("- Target files checked: ").append(targetCount).append(NL).append(NL);
        appendChecks(sb, outcome.checks());
        return sb.toString();
    }

    public static String verificationJson(VerificationOutcome outcome) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("timestamp", String.valueOf(outcome.verifiedAt()));
        root.put("checks", checksJson(outcome.checks()));
        Map<String, Object> overall = new LinkedHashMap<>();
        overall.put("passed", outcome.passed());
        overall.put("total_checks", outcome.checks().size());
        overall.put("passed_checks", outcome.passedCount());
        root.put("overall", overall);
        return Jsons.toJson(root) + NL;
    }

    private static void appendScenario(StringBuilder sb, int index, ScenarioResult scenario) {
        sb.append("## Scenario ").append(index).append(": ").append(scenario.title())
                .append(" (`").append(scenario.name()).append("`)").append(NL).append(NL);
        bullet(sb, "Status", scenario.status().label().toUpperCase(Locale.ROOT));
        bullet(sb, "Verified", yesNo(scenario.verified()));
        bullet(sb, "Fault nodes", scenario.faultNodes().isEmpty() ? "(none)" : String.join(", ", scenario.faultNodes()));
        bullet(sb, "Tombstone created", yesNo(scenario.tombstoneCreated()));
        bullet(sb, "Partial failure detected", yesNo(scenario.partialFailureDetected()));
        bullet(sb, "Auto cleanup", yesNo(scenario.autoCleanup()));
        bullet(sb, "Residue free", yesNo(scenario.residueFree()));
        bullet(sb, "Phase reached", scenario.phaseReached().name());
        bullet(sb, "Duration", seconds(scenario.durationMs()));
        bullet(sb, "Target files", new TargetFileSet(scenario.targetFiles()).describeRange());
        bullet(sb, "Deletes not accepted", scenario.degradedDeletes() + "/" + scenario.deleteOutcomes().size());
        bullet(sb, "Total files (before / after)", scenario.initialTotalFiles() + " / " + scenario.finalTotalFiles());
        if (scenario.failureReason() != null) {
            bullet(sb, "Failure reason", scenario.failureReason());
        }
        sb.append(NL);

        if (!scenario.deleteOutcomes().isEmpty()) {
            sb.append("### Delete operations").append(NL).append(NL);
            sb.append("| File | Result | Status | Response |").append(NL);
            sb.append("|------|--------|--------|----------|").append(NL);
            for (DeleteOutcome outcome : scenario.deleteOutcomes()) {
                sb.append("| ").append(cell(outcome.file()))
                        .append(" | ").append(outcome.accepted() ? "OK" : "FAIL")
                        .append(" | ").append(outcome.status())
                        .append(" | ").append(cell(truncate(outcome.detail(), RESPONSE_COLUMN_CHARS)))
                        .append(" |").append(NL);
            }
            sb.append(NL);
        }

        if (!scenario.cleanupEvents().isEmpty()) {
            sb.append("### Auto-cleanup events").append(NL).append(NL);
            for (ProtocolEvent event : scenario.cleanupEvents()) {
                sb.append("- ").append(event.sourceNode()).append(": `")
                        .append(truncate(event.rawLine(), 120).replace("`", "'")).append('`').append(NL);
            }
            sb.append(NL);
        }

        if (!scenario.orphans().isEmpty()) {
            sb.append("### Residual files").append(NL).append(NL);
            for (OrphanFile orphan : scenario.orphans()) {
                sb.append("- ").append(orphan.node()).append(": ").append(orphan.file()).append(NL);
            }
            sb.append(NL);
        }
    }

    private static void appendChecks(StringBuilder sb, Map<String, CheckResult> checks) {
        sb.append("| Check | Result | Detail |").append(NL);
        sb.append("|-------|--------|--------|").append(NL);
        for (CheckResult check : checks.values()) {
            sb.append("| ").append(cell(check.name()))
                    .append(" | ").append(check.passed() ? "PASS" : "FAIL")
                    .append(" | ").append(cell(check.detail()))
                    .append(" |").append(NL);
        }
        sb.append(NL);
        for (CheckResult check : checks.values()) {
            Object orphans = check.payload().get("orphan_files");
            if (!(orphans instanceof List) || ((List<?>) orphans).isEmpty()) {
                continue;
            }
            sb.append("#### Orphan files (").append(check.name()).append(")").append(NL).append(NL);
            for (Object item : (List<?>) orphans) {
                if (item instanceof Map) {
                    Map<?, ?> row = (Map<?, ?>) item;
                    sb.append("- ").append(row.get("worker")).append(": ").append(row.get("file")).append(NL);
                } else {
                    sb.append("- ").append(item).append(NL);
                }
            }
            sb.append(NL);
        }
    }

    private static void appendConclusion(StringBuilder sb, Report report) {
        sb.append("## Conclusion").append(NL).append(NL);
        if (report.overallPassed()) {
            sb.append("All scenarios converged and every check passed: deletes issued while nodes were down ")
                    .append("were recorded as tombstones, and the restarted nodes had their stale copies removed.")
                    .append(NL);
            return;
        }
        sb.append("The run did not pass. Items to investigate:").append(NL).append(NL);
        PreconditionResult precondition = report.precondition();
        if (precondition != null && !precondition.ok()) {
            sb.append("- Environment precondition failed: ").append(precondition.summary()).append(NL);
        }
        if (report.aborted()) {
            sb.append("- Run was aborted by the operator before completion").append(NL);
        }
        for (ScenarioResult scenario : report.scenarios()) {
            if (scenario.verified()) {
                continue;
            }
            List<String> why = new ArrayList<>();
            if (!scenario.passed()) {
                why.add(scenario.failureReason() == null ? "status " + scenario.status().label() : scenario.failureReason());
            }
            if (!scenario.tombstoneCreated()) {
                why.add("no tombstone marker");
            }
            if (!scenario.autoCleanup()) {
                why.add("no convergence within the wait");
            }
            sb.append("- Scenario `").append(scenario.name()).append("`: ").append(String.join("; ", why)).append(NL);
        }
        for (CheckResult check : report.checks().values()) {
            if (!check.passed()) {
                sb.append("- Check `").append(check.name()).append("`: ").append(check.detail()).append(NL);
            }
        }
        sb.append(NL).append("Review the coordinator and worker logs, the coordinator file index, and the ")
                .append("tombstone creation path.").append(NL);
    }

    private static Map<String, Object> scenarioJson(ScenarioResult scenario) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", scenario.name());
        out.put("title", scenario.title());
        out.put("status", scenario.status().label());
        out.put("verified", scenario.verified());
        out.put("phase_reached", scenario.phaseReached().name());
        out.put("failure_reason", scenario.failureReason());
        out.put("fault_nodes", scenario.faultNodes());
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (NodeHandle node : scenario.nodes()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", node.id());
            row.put("state", node.state().name().toLowerCase(Locale.ROOT));
            nodes.add(row);
        }
        out.put("nodes", nodes);
        out.put("test_files", scenario.targetFiles());
        List<Map<String, Object>> deletes = new ArrayList<>();
        for (DeleteOutcome outcome : scenario.deleteOutcomes()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("file", outcome.file());
            row.put("status", outcome.status());
            if (outcome.response() != null) {
                row.put("response", outcome.response());
            }
            if (outcome.error() != null) {
                row.put("error", outcome.error());
            }
            row.put("timestamp", String.valueOf(outcome.timestamp()));
            deletes.add(row);
        }
        out.put("delete_results", deletes);
        out.put("degraded_deletes", scenario.degradedDeletes());
        out.put("tombstone_created", scenario.tombstoneCreated());
        out.put("partial_failure_detected", scenario.partialFailureDetected());
        out.put("auto_cleanup", scenario.autoCleanup());
        out.put("residue_free", scenario.residueFree());
        List<String> events = new ArrayList<>();
        for (ProtocolEvent event : scenario.cleanupEvents()) {
            events.add(event.rawLine());
        }
        out.put("cleanup_events", events);
        List<Map<String, Object>> orphans = new ArrayList<>();
        for (OrphanFile orphan : scenario.orphans()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("worker", orphan.node());
            row.put("file", orphan.file());
            orphans.add(row);
        }
        out.put("orphan_files", orphans);
        out.put("initial_total_files", scenario.initialTotalFiles());
        out.put("final_total_files", scenario.finalTotalFiles());
        out.put("start_time", String.valueOf(scenario.startedAt()));
        out.put("end_time", String.valueOf(scenario.endedAt()));
        out.put("duration", scenario.durationMs() / 1000.0);
        return out;
    }

    private static Map<String, Object> checksJson(Map<String, CheckResult> checks) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (CheckResult check : checks.values()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("passed", check.passed());
            row.put("details", check.detail());
            row.putAll(check.payload());
            out.put(check.name(), row);
        }
        return out;
    }

    private static Map<String, Object> preconditionJson(PreconditionResult precondition) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (precondition == null) {
            out.put("ok", false);
            out.put("problems", List.of("not evaluated"));
            return out;
        }
        out.put("ok", precondition.ok());
        out.put("containers_up", precondition.containersUp());
        out.put("coordinator_healthy", precondition.coordinatorHealthy());
        out.put("total_files", precondition.totalFiles());
        out.put("min_file_count", precondition.minFileCount());
        out.put("problems", precondition.problems());
        return out;
    }

    private static String preconditionLine(PreconditionResult precondition) {
        if (precondition == null) {
            return "not evaluated";
        }
        return precondition.ok()
                ? "ok (" + precondition.totalFiles() + " files indexed)"
                : "FAILED: " + precondition.summary();
    }

    private static int countVerified(List<ScenarioResult> scenarios) {
        int count = 0;
        for (ScenarioResult scenario : scenarios) {
            if (scenario.verified()) {
                count++;
            }
        }
        return count;
    }

    private static int countPassed(Map<String, CheckResult> checks) {
        int count = 0;
        for (CheckResult check : checks.values()) {
            if (check.passed()) {
                count++;
            }
        }
        return count;
    }

    private static void bullet(StringBuilder sb, String label, String value) {
        sb.append("- **").append(label).append("**: ").append(value).append(NL);
    }

    static String seconds(long ms) {
        return String.format(Locale.ROOT, "%.1fs", ms / 1000.0);
    }

    static String truncate(String raw, int max) {
        if (raw == null) {
            return "";
        }
        String flat = raw.replace("\r", " ").replace("\n", " ");
        return flat.length() <= max ? flat : flat.substring(0, max);
    }

    static String cell(String raw) {
        return raw == null ? "" : raw.replace("|", "\\|").replace("\n", " ");
    }

    private static String yesNo(boolean value) {
        return value ? "yes" : "no";
    }
}
