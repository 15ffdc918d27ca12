package com.clustergate.gatekeeper.validation;

import org.springframework.stereotype.Component;

/**
 * Form checks on the credentials an operator types in.
 *
 * Both methods are pure: rules are evaluated in a fixed order and the first
 * one that matches decides the outcome.
 */
@Component
public class CredentialValidator {

    static final int MIN_PASSWORD_LENGTH = 6;

    /**
     * Check the administrator account that will be created on the cluster.
     */
    public ValidationOutcome validate(String username, String password, String passwordConfirm) {
        if (isEmpty(username)) {
            return ValidationOutcome.failure("Administrator username not provided");
        }
        if (isEmpty(password) || isEmpty(passwordConfirm)) {
            return ValidationOutcome.failure("Administrator password not provided");
        }
        if (!password.equals(passwordConfirm)) {
            return ValidationOutcome.failure("Password entries do not match");
        }
        // characters, not UTF-16 units: an emoji counts once
        if (password.codePointCount(0, password.length()) < MIN_PASSWORD_LENGTH) {
            return ValidationOutcome.failure(
                    "Password must contain at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        return ValidationOutcome.success();
    }

    /**
     * Check the inputs the reachability probe and the deployment tool need to
     * log into the target machines. Runs before the probe so we never open an
     * SSH session with an obviously missing password.
     */
    public ValidationOutcome validateRemoteAccess(String keyName, String rootPassword) {
        if (isEmpty(keyName)) {
            return ValidationOutcome.failure("Deployment key name not provided");
        }
        if (isEmpty(rootPassword)) {
            return ValidationOutcome.failure("Root password for cluster machines not provided");
        }
        return ValidationOutcome.success();
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
