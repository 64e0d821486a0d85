package io.tombwatch.verify;

import io.tombwatch.model.CheckResult;
import io.tombwatch.observability.HarnessLog;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every check, in order, regardless of earlier failures. A check that throws, or
 * returns nothing, is recorded as failed under its own name, so the outcome always has
 * exactly one result per check.
 */
public final class VerificationAggregator {
    private final List<VerificationCheck> checks;
    private final HarnessLog log;
    private final Clock clock;

    public VerificationAggregator(List<VerificationCheck> checks, HarnessLog log, Clock clock) {
        this.checks = List.copyOf(checks);
        this.log = log == null ? HarnessLog.silent() : log;
        this.clock = clock;
    }

    public static VerificationAggregator standard(HarnessLog log, Clock clock) {
        return new VerificationAggregator(TombstoneChecks.standard(), log, clock);
    }

    public VerificationOutcome verify(VerificationContext context) {
        log.info("=".repeat(60));
        log.info("Verifying final cluster state (" + checks.size() + " checks, "
                + context.targets().size() + " target files)");
        log.info("=".repeat(60));
        Map<String, CheckResult> results = new LinkedHashMap<>();
        for (VerificationCheck check : checks) {
            CheckResult result;
            try {
                result = check.run(context);
                if (result == null) {
                    result = CheckResult.of(check.name(), false, "check returned no result", Map.of());
                } else if (!check.name().equals(result.name())) {
                    result = CheckResult.of(check.name(), result.passed(), result.detail(), result.payload());
                }
            } catch (Exception e) {
                log.error("Check " + check.name() + " raised: " + e.getMessage());
                result = CheckResult.error(check.name(), e);
            }
            results.put(check.name(), result);
            log.info("  " + check.name() + ": " + (result.passed() ? "PASS" : "FAIL") + " - " + result.detail());
            log.record("verify.check", null, result.passed() ? "pass" : "fail", Map.of(
                    "check", check.name(),
                    "detail", result.detail()
            ));
        }
        VerificationOutcome outcome = new VerificationOutcome(clock.instant(), results);
        log.info("Checks passed: " + outcome.passedCount() + "/" + results.size());
        return outcome;
    }
}
