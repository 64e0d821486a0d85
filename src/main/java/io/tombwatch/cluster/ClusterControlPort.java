package io.tombwatch.cluster;

import java.util.List;
import java.util.Set;

/**
 * Node lifecycle and node-local inspection, backed by whatever manages the storage
 * processes (a container manager in production, an in-memory fake in tests).
 *
 * <p>{@link #stop(String)} and {@link #start(String)} return only once the backend has
 * confirmed the command completed. Log retrieval never throws (an unreachable node has
 * no logs); a failed file listing is reported as {@link NodeInspectionException} so it
 * is never mistaken for an empty node.
 */
public interface ClusterControlPort {
    ControlOutcome stop(String nodeId);

    ControlOutcome start(String nodeId);

    Set<String> listFiles(String nodeId) throws NodeInspectionException;

    String fetchLogs(String nodeId);

    default List<String> fetchLogs(String nodeId, String pattern) {
        String text = fetchLogs(nodeId);
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String needle = pattern == null ? "" : pattern;
        return text.lines()
                .filter(line -> needle.isEmpty() || line.contains(needle))
                .toList();
    }

    boolean clusterUp();

    String describe();
}
