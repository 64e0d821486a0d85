package io.tombwatch.verify;

import io.tombwatch.model.CheckResult;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record VerificationOutcome(Instant verifiedAt, Map<String, CheckResult> checks) {
    public VerificationOutcome {
        checks = checks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }

    public boolean passed() {
        if (checks.isEmpty()) {
            return false;
        }
        for (CheckResult check : checks.values()) {
            if (!check.passed()) {
                return false;
            }
        }
        return true;
    }

    public int passedCount() {
        int count = 0;
        for (CheckResult check : checks.values()) {
            if (check.passed()) {
                count++;
            }
        }
        return count;
    }
}
