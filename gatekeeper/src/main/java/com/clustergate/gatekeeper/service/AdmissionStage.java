package com.clustergate.gatekeeper.service;

/**
 * Admission pipeline stages, in the order they run.
 */
public enum AdmissionStage {
    CREDENTIALS,
    TOPOLOGY,
    REMOTE_ACCESS,
    REACHABILITY,
    LOCK,
    LAUNCH
}
