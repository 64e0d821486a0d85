package io.tombwatch.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Report(
        String runId,
        String masterUrl,
        Instant generatedAt,
        Instant startedAt,
        Instant endedAt,
        PreconditionResult precondition,
        List<ScenarioResult> scenarios,
        Map<String, CheckResult> checks,
        boolean aborted
) {
    public Report {
        scenarios = scenarios == null ? List.of() : List.copyOf(scenarios);
        checks = checks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }

    public boolean overallPassed() {
        if (aborted || precondition == null || !precondition.ok()) {
            return false;
        }
        if (scenarios.isEmpty() && checks.isEmpty()) {
            return false;
        }
        for (ScenarioResult scenario : scenarios) {
            if (!scenario.verified()) {
                return false;
            }
        }
        for (CheckResult check : checks.values()) {
            if (!check.passed()) {
                return false;
            }
        }
        return true;
    }

    public int targetFileCount() {
        int count = 0;
        for (ScenarioResult scenario : scenarios) {
            count += scenario.targetFiles().size();
        }
        return count;
    }
}
