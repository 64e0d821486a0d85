package io.tombwatch.model;

public record NodeHandle(String id, NodeState state) {
    public NodeHandle {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("node id cannot be empty");
        }
        id = id.trim();
        state = state == null ? NodeState.UNKNOWN : state;
    }

    public static NodeHandle unknown(String id) {
        return new NodeHandle(id, NodeState.UNKNOWN);
    }

    public NodeHandle withState(NodeState next) {
        return new NodeHandle(id, next);
    }
}
