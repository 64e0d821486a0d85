package io.tombwatch.model;

public enum ScenarioPhase {
    INIT,
    FAULT_INJECTED,
    OPERATION_ISSUED,
    FAULT_RECOVERED,
    CONVERGING,
    DONE
}
