package io.tombwatch.scenario;

import io.tombwatch.config.TombWatchSettings;
import io.tombwatch.model.TargetFileSet;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class Scenarios {
    public static final String SINGLE_NODE_RESTART = "single-node-restart";
    public static final String PARTIAL_DELETE_FAILURE = "partial-delete-failure";
    public static final String ALL = "all";

    private Scenarios() {
    }

    public static ScenarioDefinition singleNodeRestart(TombWatchSettings settings) {
        List<String> workers = settings.workers();
        return new ScenarioDefinition(
                SINGLE_NODE_RESTART,
                "Delete while one node is down, then restart it",
                List.of(pick(workers, 1)),
                TargetFileSet.numbered(settings.targetFilePattern(), 0, 10),
                Duration.ofMillis(settings.settleAfterStopMs()),
                Duration.ofMillis(settings.deleteSpacingMs()),
                Duration.ofMillis(settings.settleAfterStartMs()),
                Duration.ofMillis(settings.convergenceTimeoutMs()),
                Duration.ofMillis(settings.pollIntervalMs()),
                false
        );
    }

    public static ScenarioDefinition partialDeleteFailure(TombWatchSettings settings) {
        List<String> workers = settings.workers();
        List<String> fault = new ArrayList<>();
        fault.add(pick(workers, 0));
        String second = pick(workers, 1);
        if (!fault.contains(second)) {
            fault.add(second);
        }
        return new ScenarioDefinition(
                PARTIAL_DELETE_FAILURE,
                "Partial delete failure with two nodes down",
                fault,
                TargetFileSet.numbered(settings.targetFilePattern(), 10, 20),
                Duration.ofMillis(settings.settleAfterPartialStopMs()),
                Duration.ofMillis(settings.deleteSpacingMs()),
                Duration.ofMillis(settings.settleAfterStartMs()),
                Duration.ofMillis(settings.convergenceTimeoutMs()),
                Duration.ofMillis(settings.pollIntervalMs()),
                true
        );
    }

    public static List<ScenarioDefinition> select(String selector, TombWatchSettings settings) {
        String value = selector == null || selector.isBlank() ? ALL : selector.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case ALL -> List.of(singleNodeRestart(settings), partialDeleteFailure(settings));
            case SINGLE_NODE_RESTART, "4.1", "a" -> List.of(singleNodeRestart(settings));
            case PARTIAL_DELETE_FAILURE, "4.2", "b" -> List.of(partialDeleteFailure(settings));
            default -> throw new IllegalArgumentException("Unknown scenario: " + selector
                    + " (expected " + ALL + "|" + SINGLE_NODE_RESTART + "|" + PARTIAL_DELETE_FAILURE + ")");
        };
    }

    public static TargetFileSet allTargets(TombWatchSettings settings) {
        return TargetFileSet.numbered(settings.targetFilePattern(), 0, 20);
    }

    private static String pick(List<String> workers, int index) {
        if (workers.isEmpty()) {
            throw new IllegalArgumentException("no workers configured");
        }
        return workers.get(Math.min(index, workers.size() - 1));
    }
}
