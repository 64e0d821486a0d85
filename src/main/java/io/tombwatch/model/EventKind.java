package io.tombwatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventKind {
    TOMBSTONE_CREATED("tombstone-created"),
    PARTIAL_DELETE_FAILURE("partial-delete-failure"),
    AUTO_CLEANUP("auto-cleanup");

    private final String label;

    EventKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static EventKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("event kind cannot be empty");
        }
        String value = raw.trim();
        for (EventKind kind : values()) {
            if (kind.name().equalsIgnoreCase(value) || kind.label.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown event kind: " + raw);
    }
}
