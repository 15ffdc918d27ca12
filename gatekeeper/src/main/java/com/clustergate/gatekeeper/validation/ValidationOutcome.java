package com.clustergate.gatekeeper.validation;

/**
 * Result of a single admission check.
 *
 * On success {@code message} is whatever the check wants to show the operator
 * (empty for credentials, the rendered layout for topology). On failure it is
 * exactly one reason.
 */
public record ValidationOutcome(boolean ok, String message) {

    public ValidationOutcome {
        if (message == null) message = "";
    }

    public static ValidationOutcome success() {
        return new ValidationOutcome(true, "");
    }

    public static ValidationOutcome success(String message) {
        return new ValidationOutcome(true, message);
    }

    public static ValidationOutcome failure(String reason) {
        return new ValidationOutcome(false, reason);
    }
}
