package io.tombwatch.util;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

public final class RunCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicReference<String> reason = new AtomicReference<>("");

    public void cancel(String why) {
        if (cancelled.compareAndSet(false, true)) {
            reason.set(why == null ? "" : why);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String reason() {
        return reason.get();
    }
}
