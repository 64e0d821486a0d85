package io.tombwatch.model;

public enum NodeState {
    UP,
    DOWN,
    UNKNOWN
}
