package io.tombwatch.verify;

import io.tombwatch.cluster.ClusterControlPort;
import io.tombwatch.cluster.ClusterQueryPort;
import io.tombwatch.model.TargetFileSet;
import io.tombwatch.observer.EventObserver;

import java.util.ArrayList;
import java.util.List;

public record VerificationContext(
        ClusterControlPort control,
        ClusterQueryPort query,
        EventObserver observer,
        List<String> workers,
        String coordinator,
        TargetFileSet targets
) {
    public VerificationContext {
        workers = workers == null ? List.of() : List.copyOf(workers);
        targets = targets == null ? new TargetFileSet(List.of()) : targets;
    }

    public List<String> logSources() {
        List<String> out = new ArrayList<>(workers);
        if (coordinator != null && !out.contains(coordinator)) {
            out.add(coordinator);
        }
        return out;
    }
}
