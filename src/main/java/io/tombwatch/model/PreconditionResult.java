package io.tombwatch.model;

import java.util.List;

public record PreconditionResult(
        boolean ok,
        boolean containersUp,
        boolean coordinatorHealthy,
        long totalFiles,
        int minFileCount,
        List<String> problems
) {
    public PreconditionResult {
        problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public String summary() {
        return ok ? "ok" : String.join("; ", problems);
    }
}
