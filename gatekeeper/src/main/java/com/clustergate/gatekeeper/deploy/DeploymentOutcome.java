package com.clustergate.gatekeeper.deploy;

import java.nio.file.Path;

/**
 * What the external deployment tool reported when it finished.
 *
 * @param exitCode process exit code, or -1 if the process never ran to completion
 * @param logFile  captured stdout/stderr, or null if no log was written
 */
public record DeploymentOutcome(boolean succeeded, int exitCode, Path logFile, String message) {

    public static DeploymentOutcome success(Path logFile) {
        return new DeploymentOutcome(true, 0, logFile, "Deployment completed");
    }

    public static DeploymentOutcome failure(int exitCode, Path logFile, String message) {
        return new DeploymentOutcome(false, exitCode, logFile, message);
    }
}
