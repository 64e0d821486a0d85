package io.tombwatch.util;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> {
        long ms = duration.toMillis();
        if (ms > 0L) {
            Thread.sleep(ms);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
