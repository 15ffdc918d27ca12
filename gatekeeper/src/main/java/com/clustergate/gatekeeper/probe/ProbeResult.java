package com.clustergate.gatekeeper.probe;

/**
 * Outcome of probing one host.
 *
 * @param reachable true if a session was opened and the no-op command ran
 * @param reason    why not, or null when reachable
 * @param host      the host the outcome is about
 */
public record ProbeResult(boolean reachable, ProbeFailure reason, String host) {

    public static ProbeResult reachable(String host) {
        return new ProbeResult(true, null, host);
    }

    public static ProbeResult failed(ProbeFailure reason, String host) {
        return new ProbeResult(false, reason, host);
    }

    /** Operator-facing text: empty on success, the host-qualified reason otherwise. */
    public String message() {
        return reachable ? "" : reason.describe(host);
    }
}
