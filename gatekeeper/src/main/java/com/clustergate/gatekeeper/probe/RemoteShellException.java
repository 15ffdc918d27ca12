package com.clustergate.gatekeeper.probe;

/**
 * Thrown by a {@link RemoteShell} when a session cannot be opened or used.
 * Carries the transport fault already mapped to a {@link ProbeFailure}.
 */
public class RemoteShellException extends RuntimeException {

    private final ProbeFailure failure;

    public RemoteShellException(ProbeFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public RemoteShellException(ProbeFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public ProbeFailure getFailure() { return failure; }
}
