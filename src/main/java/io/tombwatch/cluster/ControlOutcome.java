package io.tombwatch.cluster;

public record ControlOutcome(boolean ok, String message) {
    public static ControlOutcome ok(String message) {
        return new ControlOutcome(true, message);
    }

    public static ControlOutcome fail(String message) {
        return new ControlOutcome(false, message);
    }
}
