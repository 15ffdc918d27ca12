package com.clustergate.gatekeeper.service;

/**
 * What kind of problem rejected a deployment, so the caller can tell the
 * operator where to look.
 *
 * <ul>
 *   <li>INPUT: missing or malformed credentials or layout; fix the form</li>
 *   <li>SCHEMA: unknown role or uncovered required role; fix ips.yaml</li>
 *   <li>NETWORK: timeout, unreachable, refused; check the machines</li>
 *   <li>AUTH: root password rejected; check the password, not the network</li>
 *   <li>UNKNOWN: anything else; details are in the server log only</li>
 *   <li>CONCURRENCY: another deployment holds the lock</li>
 * </ul>
 */
public enum FailureCategory {
    INPUT,
    SCHEMA,
    NETWORK,
    AUTH,
    UNKNOWN,
    CONCURRENCY
}
