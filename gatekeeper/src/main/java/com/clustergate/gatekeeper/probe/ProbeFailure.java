package com.clustergate.gatekeeper.probe;

/**
 * Why a preflight probe could not use a host. Each kind has its own operator
 * message so a bad password is never reported as a network problem.
 */
public enum ProbeFailure {

    TIMEOUT("Connection timed out for %s"),
    UNREACHABLE("Host unreachable error for %s"),
    CONNECTION_REFUSED("Connection refused for %s"),
    AUTH_FAILED("Authentication failed for %s - Please ensure that the specified root password is correct"),
    UNKNOWN("Unexpected runtime error connecting to %s");

    private final String template;

    ProbeFailure(String template) {
        this.template = template;
    }

    public String describe(String host) {
        return template.formatted(host);
    }
}
