package io.tombwatch.scenario;

import io.tombwatch.model.TargetFileSet;

import java.time.Duration;
import java.util.List;

public record ScenarioDefinition(
        String name,
        String title,
        List<String> faultNodes,
        TargetFileSet targets,
        Duration settleAfterStop,
        Duration deleteSpacing,
        Duration settleAfterStart,
        Duration convergenceTimeout,
        Duration pollInterval,
        boolean checkPartialFailure
) {
    public ScenarioDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("scenario name cannot be empty");
        }
        if (faultNodes == null || faultNodes.isEmpty()) {
            throw new IllegalArgumentException("scenario needs at least one fault node: " + name);
        }
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("scenario needs at least one target file: " + name);
        }
        faultNodes = List.copyOf(faultNodes);
        title = title == null || title.isBlank() ? name : title;
        settleAfterStop = nonNegative(settleAfterStop);
        deleteSpacing = nonNegative(deleteSpacing);
        settleAfterStart = nonNegative(settleAfterStart);
        convergenceTimeout = nonNegative(convergenceTimeout);
        pollInterval = pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()
                ? Duration.ofSeconds(1)
                : pollInterval;
    }

    private static Duration nonNegative(Duration value) {
        return value == null || value.isNegative() ? Duration.ZERO : value;
    }
}
