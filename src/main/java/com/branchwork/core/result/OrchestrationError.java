package com.branchwork.core.result;

import java.io.Serializable;
import java.util.Objects;

/**
 * A failure carried by {@link Result}: a machine-readable code plus a human-readable message.
 *
 * @param code    the failure category
 * @param message description suitable for logs and for an assignment's {@code errorMessage}
 */
public record OrchestrationError(ErrorCode code, String message) implements Serializable {

    public OrchestrationError {
        Objects.requireNonNull(code, "code");
        message = message == null || message.isBlank() ? code.name() : message;
    }

    public static OrchestrationError of(ErrorCode code, String message) {
        return new OrchestrationError(code, message);
    }

    public static OrchestrationError cancelled(String message) {
        return new OrchestrationError(ErrorCode.CANCELLED, message);
    }

    public static OrchestrationError workFailure(String message) {
        return new OrchestrationError(ErrorCode.WORK_FUNCTION_FAILURE, message);
    }

    public boolean is(ErrorCode other) {
        return code == other;
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
