package io.tombwatch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record CheckResult(
        String name,
        boolean passed,
        String detail,
        Map<String, Object> payload
) {
    public CheckResult {
        detail = detail == null ? "" : detail;
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static CheckResult of(String name, boolean passed, String detail, Map<String, Object> payload) {
        return new CheckResult(name, passed, detail, payload);
    }

    public static CheckResult error(String name, Throwable error) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new CheckResult(name, false, "check raised " + error.getClass().getSimpleName() + ": " + message, Map.of());
    }
}
