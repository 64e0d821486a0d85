package io.tombwatch.cluster;

import io.tombwatch.model.DeleteOutcome;

import java.util.Map;

public interface ClusterQueryPort {
    String TOTAL_FILES = "total_files";
    String ACTIVE_NODES = "active_nodes";

    /**
     * Never throws; transport failures are recorded in the returned outcome.
     */
    DeleteOutcome deleteFile(String name, String credential);

    Map<String, Long> getStats() throws ClusterUnavailableException;

    boolean health();
}
