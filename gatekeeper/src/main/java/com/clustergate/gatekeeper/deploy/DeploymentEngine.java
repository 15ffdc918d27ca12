package com.clustergate.gatekeeper.deploy;

/**
 * The long-running external process that actually builds the cluster.
 * The gate only decides whether it may start and holds the lock around it.
 */
public interface DeploymentEngine {

    /**
     * Run one deployment to completion. Blocks for as long as the deployment takes.
     * Failures of the deployment itself are reported in the outcome, not thrown.
     */
    DeploymentOutcome deploy(DeploymentOptions options);
}
