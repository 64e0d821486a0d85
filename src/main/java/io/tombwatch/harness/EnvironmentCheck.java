package io.tombwatch.harness;

import io.tombwatch.cluster.ClusterControlPort;
import io.tombwatch.cluster.ClusterQueryPort;
import io.tombwatch.cluster.ClusterUnavailableException;
import io.tombwatch.model.PreconditionResult;
import io.tombwatch.observability.HarnessLog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class EnvironmentCheck {
    private final ClusterControlPort control;
    private final ClusterQueryPort query;
    private final HarnessLog log;
    private final int minFileCount;

    public EnvironmentCheck(ClusterControlPort control, ClusterQueryPort query, HarnessLog log, int minFileCount) {
        this.control = control;
        this.query = query;
        this.log = log == null ? HarnessLog.silent() : log;
        this.minFileCount = Math.max(0, minFileCount);
    }

    public PreconditionResult evaluate() {
        List<String> problems = new ArrayList<>();
        log.info("Checking environment (" + control.describe() + ")");

        boolean up = control.clusterUp();
        if (up) {
            log.info("  containers: up");
        } else {
            problems.add("cluster containers are not running");
            log.error("  containers: not running");
        }

        boolean healthy = query.health();
        if (healthy) {
            log.info("  coordinator: healthy");
        } else {
            problems.add("coordinator health check failed");
            log.error("  coordinator: not healthy");
        }

        long totalFiles = 0L;
        try {
            Map<String, Long> stats = query.getStats();
            totalFiles = stats.getOrDefault(ClusterQueryPort.TOTAL_FILES, 0L);
            log.info("  indexed files: " + totalFiles + " (need " + minFileCount + ")");
            if (totalFiles < minFileCount) {
                problems.add("only " + totalFiles + " file(s) indexed, need at least " + minFileCount
                        + "; upload test files first");
            }
        } catch (ClusterUnavailableException e) {
            problems.add("stats unavailable: " + e.getMessage());
            log.error("  stats unavailable: " + e.getMessage());
        }

        PreconditionResult result = new PreconditionResult(problems.isEmpty(), up, healthy, totalFiles, minFileCount, problems);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("containers_up", up);
        details.put("coordinator_healthy", healthy);
        details.put("total_files", totalFiles);
        details.put("min_file_count", minFileCount);
        details.put("problems", result.problems());
        log.record("env.check", null, result.ok() ? "ok" : "failed", details);
        return result;
    }
}
