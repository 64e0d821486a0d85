package io.tombwatch.cluster;

public final class ClusterUnavailableException extends Exception {
    public ClusterUnavailableException(String message) {
        super(message);
    }

    public ClusterUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
