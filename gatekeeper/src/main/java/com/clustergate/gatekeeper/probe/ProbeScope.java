package com.clustergate.gatekeeper.probe;

/**
 * Which hosts the preflight probe opens a session to.
 *
 * FIRST_HOST assumes every machine shares one network and one root password,
 * which holds for typical deployments. ALL_HOSTS costs one SSH handshake per
 * host but catches fleets where that assumption breaks.
 */
public enum ProbeScope {
    FIRST_HOST,
    ALL_HOSTS
}
