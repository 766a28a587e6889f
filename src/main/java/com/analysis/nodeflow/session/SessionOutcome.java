package com.analysis.nodeflow.session;

import java.util.Objects;

/**
 * Result of running one piece of code in a session.
 *
 * @param output text the code printed
 * @param error  error text; empty on success
 */
public record SessionOutcome(SessionStatus status, String output, String error) {
    public SessionOutcome {
        Objects.requireNonNull(status, "status");
        output = output == null ? "" : output;
        error = error == null ? "" : error;
    }

    public static SessionOutcome success(String output) {
        return new SessionOutcome(SessionStatus.SUCCESS, output, "");
    }

    public static SessionOutcome error(String output, String error) {
        return new SessionOutcome(SessionStatus.ERROR, output, error);
    }

    public static SessionOutcome timeout(String output) {
        return new SessionOutcome(SessionStatus.TIMEOUT, output, "Execution timed out");
    }

    public boolean isSuccess() {
        return status == SessionStatus.SUCCESS;
    }
}
