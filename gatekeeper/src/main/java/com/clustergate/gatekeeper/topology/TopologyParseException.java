package com.clustergate.gatekeeper.topology;

/**
 * Thrown when ips.yaml text cannot be turned into a {@link TopologyRequest}.
 * The message is safe to show to the operator; parser internals stay in the cause.
 */
public class TopologyParseException extends RuntimeException {

    public TopologyParseException(String message) {
        super(message);
    }

    public TopologyParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
