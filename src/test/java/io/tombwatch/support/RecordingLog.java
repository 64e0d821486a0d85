package io.tombwatch.support;

import io.tombwatch.observability.HarnessLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class RecordingLog implements HarnessLog {
    private final List<String> lines = new ArrayList<>();
    private final List<String> actions = new ArrayList<>();

    @Override
    public synchronized void log(Level level, String message) {
        lines.add(level + " " + message);
    }

    @Override
    public synchronized void record(String action, String node, String result, Map<String, Object> details) {
        actions.add(action + (node == null ? "" : "@" + node) + "=" + result);
    }

    public synchronized List<String> lines() {
        return List.copyOf(lines);
    }

    public synchronized List<String> actions() {
        return List.copyOf(actions);
    }

    public synchronized boolean logged(String fragment) {
        for (String line : lines) {
            if (line.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
