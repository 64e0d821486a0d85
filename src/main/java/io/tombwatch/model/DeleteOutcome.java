package io.tombwatch.model;

import java.time.Instant;

public record DeleteOutcome(
        String file,
        int status,
        String response,
        String error,
        Instant timestamp
) {
    public static final int TRANSPORT_ERROR = -1;

    public static DeleteOutcome answered(String file, int status, String body, Instant at) {
        return new DeleteOutcome(file, status, body == null ? "" : body.strip(), null, at);
    }

    public static DeleteOutcome transportFailure(String file, String error, Instant at) {
        return new DeleteOutcome(file, TRANSPORT_ERROR, null, error == null ? "unknown transport error" : error, at);
    }

    public boolean accepted() {
        return status == 200;
    }

    public String detail() {
        if (response != null) {
            return response;
        }
        return error == null ? "" : error;
    }
}
