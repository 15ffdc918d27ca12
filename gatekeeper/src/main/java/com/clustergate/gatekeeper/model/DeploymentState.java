package com.clustergate.gatekeeper.model;

/**
 * Lifecycle of an admitted deployment.
 *
 *   RUNNING → SUCCEEDED
 *   RUNNING → FAILED   (non-zero exit, engine error, or the run could not be dispatched)
 *
 * Rejected admission attempts never get a record; their reason goes straight
 * back to the caller.
 */
public enum DeploymentState {
    RUNNING,
    SUCCEEDED,
    FAILED
}
