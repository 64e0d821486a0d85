package io.tombwatch.cluster;

/**
 * A node's storage could not be listed. Callers must not read this as "no files".
 */
public final class NodeInspectionException extends Exception {
    private final String nodeId;

    public NodeInspectionException(String nodeId, String message) {
        super(nodeId + ": " + message);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
