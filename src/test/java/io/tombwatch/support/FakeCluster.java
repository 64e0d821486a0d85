package io.tombwatch.support;

import io.tombwatch.cluster.ClusterControlPort;
import io.tombwatch.cluster.ClusterQueryPort;
import io.tombwatch.cluster.ClusterUnavailableException;
import io.tombwatch.cluster.ControlOutcome;
import io.tombwatch.cluster.NodeInspectionException;
import io.tombwatch.config.TombWatchSettings;
import io.tombwatch.model.DeleteOutcome;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * In-memory cluster that models deferred deletes: a delete removes the file from every
 * running worker, records a tombstone for every stopped replica, and replays the tombstone
 * once that worker is started again.
 */
public final class FakeCluster implements ClusterControlPort, ClusterQueryPort {
    public static final String COORDINATOR = "master";

    private final List<String> workers;
    private final String secret;
    private final Map<String, Boolean> up = new LinkedHashMap<>();
    private final Map<String, Set<String>> files = new LinkedHashMap<>();
    private final Map<String, StringBuilder> logs = new HashMap<>();
    private final Map<String, Set<String>> tombstones = new HashMap<>();
    private final Map<String, Integer> cleanupCountdown = new HashMap<>();
    private final Set<String> index = new LinkedHashSet<>();
    private final Map<String, DeleteOutcome> scriptedDeletes = new HashMap<>();
    private final Set<String> failStop = new HashSet<>();
    private final Set<String> failStart = new HashSet<>();
    private final Set<String> failListing = new HashSet<>();
    private final List<String> commands = new ArrayList<>();

    private boolean containersUp = true;
    private boolean healthy = true;
    private boolean statsAvailable = true;
    private boolean autoCleanupEnabled = true;
    private int appliedDeleteStatus = 200;
    private String appliedDeleteBody;
    private int cleanupDelayListings;
    private Runnable onStop;

    public FakeCluster(List<String> workers, String secret) {
        this.workers = List.copyOf(workers);
        this.secret = secret;
        for (String worker : workers) {
            up.put(worker, true);
            files.put(worker, new LinkedHashSet<>());
            tombstones.put(worker, new LinkedHashSet<>());
        }
        up.put(COORDINATOR, true);
    }

    public static FakeCluster standard() {
        return new FakeCluster(List.of("worker1", "worker2", "worker3"), TombWatchSettings.DEFAULT_SECRET);
    }

    /**
     * Uploads {@code count} files named by {@code pattern}, replicated to every worker.
     */
    public FakeCluster seed(String pattern, int count) {
        for (int i = 0; i < count; i++) {
            String name = String.format(Locale.ROOT, pattern, i);
            index.add(name);
            for (String worker : workers) {
                files.get(worker).add(name);
            }
        }
        return this;
    }

    public FakeCluster placeFile(String worker, String name) {
        files.get(worker).add(name);
        return this;
    }

    public FakeCluster appendLog(String node, String line) {
        logs.computeIfAbsent(node, k -> new StringBuilder()).append(line).append('\n');
        return this;
    }

    public FakeCluster disableAutoCleanup() {
        this.autoCleanupEnabled = false;
        return this;
    }

    /**
     * Replays tombstones only after the restarted worker has been listed {@code listings} times.
     */
    public FakeCluster delayCleanup(int listings) {
        this.cleanupDelayListings = listings;
        return this;
    }

    public FakeCluster failStop(String node) {
        failStop.add(node);
        return this;
    }

    public FakeCluster failStart(String node) {
        failStart.add(node);
        return this;
    }

    public FakeCluster failListing(String node) {
        failListing.add(node);
        return this;
    }

    public FakeCluster respondTo(String file, int status, String body) {
        scriptedDeletes.put(file, DeleteOutcome.answered(file, status, body, Instant.EPOCH));
        return this;
    }

    /**
     * Deletes still take effect, tombstones included, but the coordinator answers
     * {@code status} with {@code body}.
     */
    public FakeCluster answerAppliedDeletesWith(int status, String body) {
        this.appliedDeleteStatus = status;
        this.appliedDeleteBody = body;
        return this;
    }

    public FakeCluster containersDown() {
        this.containersUp = false;
        return this;
    }

    public FakeCluster unhealthy() {
        this.healthy = false;
        return this;
    }

    public FakeCluster statsUnavailable() {
        this.statsAvailable = false;
        return this;
    }

    public FakeCluster onStop(Runnable hook) {
        this.onStop = hook;
        return this;
    }

    public boolean isUp(String node) {
        return up.getOrDefault(node, false);
    }

    public List<String> commands() {
        return List.copyOf(commands);
    }

    public Set<String> filesOn(String worker) {
        return Set.copyOf(files.get(worker));
    }

    @Override
    public synchronized ControlOutcome stop(String nodeId) {
        commands.add("stop " + nodeId);
        if (failStop.contains(nodeId)) {
            return ControlOutcome.fail("simulated stop failure");
        }
        up.put(nodeId, false);
        if (onStop != null) {
            onStop.run();
        }
        return ControlOutcome.ok("stopped");
    }

    @Override
    public synchronized ControlOutcome start(String nodeId) {
        commands.add("start " + nodeId);
        if (failStart.contains(nodeId)) {
            return ControlOutcome.fail("simulated start failure");
        }
        up.put(nodeId, true);
        if (autoCleanupEnabled && !tombstones.getOrDefault(nodeId, Set.of()).isEmpty()) {
            if (cleanupDelayListings <= 0) {
                replayTombstones(nodeId);
            } else {
                cleanupCountdown.put(nodeId, cleanupDelayListings);
            }
        }
        return ControlOutcome.ok("started");
    }

    @Override
    public synchronized Set<String> listFiles(String nodeId) throws NodeInspectionException {
        if (failListing.contains(nodeId) || !files.containsKey(nodeId)) {
            throw new NodeInspectionException(nodeId, "simulated listing failure");
        }
        if (!isUp(nodeId)) {
            throw new NodeInspectionException(nodeId, "container is not running");
        }
        Integer countdown = cleanupCountdown.get(nodeId);
        if (countdown != null) {
            if (countdown <= 1) {
                cleanupCountdown.remove(nodeId);
                replayTombstones(nodeId);
            } else {
                cleanupCountdown.put(nodeId, countdown - 1);
            }
        }
        return Set.copyOf(files.get(nodeId));
    }

    @Override
    public synchronized String fetchLogs(String nodeId) {
        StringBuilder sb = logs.get(nodeId);
        return sb == null ? "" : sb.toString();
    }

    @Override
    public boolean clusterUp() {
        return containersUp;
    }

    @Override
    public String describe() {
        return "fake cluster " + workers;
    }

    @Override
    public synchronized DeleteOutcome deleteFile(String name, String credential) {
        DeleteOutcome scripted = scriptedDeletes.get(name);
        if (scripted != null) {
            return scripted;
        }
        if (secret != null && !secret.equals(credential)) {
            return DeleteOutcome.answered(name, 401, "Unauthorized", Instant.EPOCH);
        }
        if (!index.remove(name)) {
            return DeleteOutcome.answered(name, 404, "Not Found", Instant.EPOCH);
        }
        int deleted = 0;
        List<String> offline = new ArrayList<>();
        for (String worker : workers) {
            if (!files.get(worker).contains(name)) {
                continue;
            }
            if (isUp(worker)) {
                files.get(worker).remove(name);
                deleted++;
            } else {
                offline.add(worker);
            }
        }
        for (String worker : offline) {
            tombstones.get(worker).add(name);
            appendLog(COORDINATOR, "[master] " + TombWatchSettings.DEFAULT_TOMBSTONE_MARKER + ": " + name + " -> " + worker);
        }
        if (offline.size() > 1) {
            appendLog(COORDINATOR, "[master] " + TombWatchSettings.DEFAULT_PARTIAL_FAILURE_MARKER + ": " + name
                    + " (" + offline.size() + " replicas offline)");
        }
        if (appliedDeleteStatus != 200) {
            return DeleteOutcome.answered(name, appliedDeleteStatus, appliedDeleteBody, Instant.EPOCH);
        }
        return DeleteOutcome.answered(name, 200, "OK:" + deleted, Instant.EPOCH);
    }

    @Override
    public synchronized Map<String, Long> getStats() throws ClusterUnavailableException {
        if (!statsAvailable) {
            throw new ClusterUnavailableException("simulated stats outage");
        }
        long active = 0L;
        for (String worker : workers) {
            if (isUp(worker)) {
                active++;
            }
        }
        Map<String, Long> out = new LinkedHashMap<>();
        out.put(ACTIVE_NODES, active);
        out.put(TOTAL_FILES, (long) index.size());
        out.put("ring_size", (long) workers.size() * 100L);
        return out;
    }

    @Override
    public boolean health() {
        return healthy && isUp(COORDINATOR);
    }

    private void replayTombstones(String worker) {
        for (String name : tombstones.get(worker)) {
            if (files.get(worker).remove(name)) {
                appendLog(COORDINATOR, "[master] " + TombWatchSettings.DEFAULT_AUTO_CLEANUP_MARKER + " " + worker + " " + name);
            }
        }
        tombstones.get(worker).clear();
    }
}
