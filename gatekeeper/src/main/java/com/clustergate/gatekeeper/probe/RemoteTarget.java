package com.clustergate.gatekeeper.probe;

/**
 * Where and as whom to open a remote session.
 */
public record RemoteTarget(String host, int port, String user, String password) {

    // Keep the password out of log lines.
    @Override
    public String toString() {
        return user + "@" + host + ":" + port;
    }
}
