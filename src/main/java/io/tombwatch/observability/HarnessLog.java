package io.tombwatch.observability;

import java.util.Map;

public interface HarnessLog {
    void log(Level level, String message);

    void record(String action, String node, String result, Map<String, Object> details);

    default void info(String message) {
        log(Level.INFO, message);
    }

    default void warn(String message) {
        log(Level.WARN, message);
    }

    default void error(String message) {
        log(Level.ERROR, message);
    }

    static HarnessLog silent() {
        return new HarnessLog() {
            @Override
            public void log(Level level, String message) {
            }

            @Override
            public void record(String action, String node, String result, Map<String, Object> details) {
            }
        };
    }

    enum Level {
        INFO,
        WARN,
        ERROR
    }
}
