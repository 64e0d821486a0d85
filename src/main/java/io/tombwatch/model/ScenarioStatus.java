package io.tombwatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScenarioStatus {
    PASSED("passed"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String label;

    ScenarioStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
