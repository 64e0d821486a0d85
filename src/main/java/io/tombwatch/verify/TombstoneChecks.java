package io.tombwatch.verify;

import io.tombwatch.cluster.ClusterQueryPort;
import io.tombwatch.cluster.NodeInspectionException;
import io.tombwatch.model.CheckResult;
import io.tombwatch.model.EventKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class TombstoneChecks {
    public static final String TOMBSTONE_RECORDS = "tombstone_records";
    public static final String WORKER_FILES = "worker_files";
    public static final String NO_ORPHAN_FILES = "no_orphan_files";
    public static final String INDEX_CONSISTENCY = "index_consistency";
    public static final String AUTO_CLEANUP = "auto_cleanup";

    private TombstoneChecks() {
    }

    public static List<VerificationCheck> standard() {
        return List.of(
                new TombstoneRecords(),
                new WorkerFiles(),
                new NoOrphanFiles(),
                new IndexConsistency(),
                new AutoCleanupTriggered()
        );
    }

    static final class TombstoneRecords implements VerificationCheck {
        @Override
        public String name() {
            return TOMBSTONE_RECORDS;
        }

        @Override
        public String description() {
            return "coordinator log shows at least one tombstone being created";
        }

        @Override
        public CheckResult run(VerificationContext context) {
            int tombstones = context.observer().countMarker(context.coordinator(), EventKind.TOMBSTONE_CREATED);
            int cleanups = context.observer().countMarker(context.coordinator(), EventKind.AUTO_CLEANUP);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("tombstone_count", tombstones);
            payload.put("auto_cleanup_count", cleanups);
            return CheckResult.of(name(), tombstones > 0,
                    "tombstones created: " + tombstones + ", auto-cleanups: " + cleanups, payload);
        }
    }

    static final class WorkerFiles implements VerificationCheck {
        @Override
        public String name() {
            return WORKER_FILES;
        }

        @Override
        public String description() {
            return "every worker holds at least one file";
        }

        @Override
        public CheckResult run(VerificationContext context) {
            Map<String, Object> counts = new LinkedHashMap<>();
            List<String> empty = new ArrayList<>();
            List<String> errors = new ArrayList<>();
            for (String worker : context.workers()) {
                try {
                    int count = context.control().listFiles(worker).size();
                    counts.put(worker, count);
                    if (count == 0) {
                        empty.add(worker);
                    }
                } catch (NodeInspectionException e) {
                    errors.add(e.getMessage());
                }
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("worker_file_counts", counts);
            if (!errors.isEmpty()) {
                payload.put("errors", errors);
            }
            boolean passed = empty.isEmpty() && errors.isEmpty() && !context.workers().isEmpty();
            String detail = passed
                    ? "all " + counts.size() + " workers store files"
                    : "empty workers: " + empty + (errors.isEmpty() ? "" : ", unreadable: " + errors.size());
            return CheckResult.of(name(), passed, detail, payload);
        }
    }

    static final class NoOrphanFiles implements VerificationCheck {
        @Override
        public String name() {
            return NO_ORPHAN_FILES;
        }

        @Override
        public String description() {
            return "no target file remains on any worker";
        }

        @Override
        public CheckResult run(VerificationContext context) {
            List<Map<String, Object>> orphans = new ArrayList<>();
            List<String> errors = new ArrayList<>();
            for (String worker : context.workers()) {
                Set<String> files;
                try {
                    files = context.control().listFiles(worker);
                } catch (NodeInspectionException e) {
                    errors.add(e.getMessage());
                    continue;
                }
                for (String target : context.targets().files()) {
                    if (files.contains(target)) {
                        Map<String, Object> orphan = new LinkedHashMap<>();
                        orphan.put("worker", worker);
                        orphan.put("file", target);
                        orphans.add(orphan);
                    }
                }
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("checked_targets", context.targets().size());
            payload.put("orphan_files", orphans);
            if (!errors.isEmpty()) {
                payload.put("errors", errors);
            }
            boolean passed = orphans.isEmpty() && errors.isEmpty();
            return CheckResult.of(name(), passed,
                    orphans.size() + " orphan file(s) among " + context.targets().size() + " target(s)"
                            + (errors.isEmpty() ? "" : ", " + errors.size() + " worker(s) unreadable"),
                    payload);
        }
    }

    // replica_coverage_ok is advisory: the replication factor is not known here
    static final class IndexConsistency implements VerificationCheck {
        @Override
        public String name() {
            return INDEX_CONSISTENCY;
        }

        @Override
        public String description() {
            return "coordinator index is non-empty and workers hold at least as many copies";
        }

        @Override
        public CheckResult run(VerificationContext context) throws Exception {
            Map<String, Long> stats = context.query().getStats();
            long coordinatorFiles = stats.getOrDefault(ClusterQueryPort.TOTAL_FILES, 0L);
            long workerFiles = 0L;
            List<String> errors = new ArrayList<>();
            for (String worker : context.workers()) {
                try {
                    workerFiles += context.control().listFiles(worker).size();
                } catch (NodeInspectionException e) {
                    errors.add(e.getMessage());
                }
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("master_file_count", coordinatorFiles);
            payload.put("total_worker_files", workerFiles);
            payload.put("replica_coverage_ok", errors.isEmpty() && workerFiles >= coordinatorFiles);
            if (!errors.isEmpty()) {
                payload.put("errors", errors);
            }
            return CheckResult.of(name(), coordinatorFiles > 0,
                    "coordinator indexes " + coordinatorFiles + " file(s), workers hold " + workerFiles,
                    payload);
        }
    }

    static final class AutoCleanupTriggered implements VerificationCheck {
        @Override
        public String name() {
            return AUTO_CLEANUP;
        }

        @Override
        public String description() {
            return "auto-cleanup marker appears in at least one node's logs";
        }

        @Override
        public CheckResult run(VerificationContext context) {
            Map<String, Object> perNode = new LinkedHashMap<>();
            boolean triggered = false;
            for (String node : context.logSources()) {
                int count = context.observer().countMarker(node, EventKind.AUTO_CLEANUP);
                perNode.put(node, count);
                triggered |= count > 0;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("auto_cleanup_counts", perNode);
            return CheckResult.of(name(), triggered,
                    triggered ? "auto-cleanup observed" : "no auto-cleanup marker in " + perNode.keySet(),
                    payload);
        }
    }
}
