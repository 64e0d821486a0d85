package io.tombwatch.verify;

import io.tombwatch.model.CheckResult;

public interface VerificationCheck {
    String name();

    String description();

    CheckResult run(VerificationContext context) throws Exception;
}
