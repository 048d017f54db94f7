package io.agentrelay.agent;

import java.util.Map;

/**
 * Result of invoking an operation. A {@link ErrorKind#CONFIGURATION} error means the task
 * can never succeed as submitted and is not retried.
 */
public record OperationOutcome(
        boolean success,
        Map<String, Object> result,
        ErrorKind errorKind,
        String error
) {
    public enum ErrorKind { CONFIGURATION, HANDLER }

    public static OperationOutcome ok(Map<String, Object> result) {
        return new OperationOutcome(true, result, null, null);
    }

    public static OperationOutcome error(ErrorKind kind, String error) {
        return new OperationOutcome(false, null, kind, error);
    }

    public boolean retryable() {
        return !success && errorKind == ErrorKind.HANDLER;
    }
}
