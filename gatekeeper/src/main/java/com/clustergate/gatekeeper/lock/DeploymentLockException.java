package com.clustergate.gatekeeper.lock;

/**
 * Thrown when the lock's backing store cannot be read or written
 * (permissions, full disk, missing directory that cannot be created).
 */
public class DeploymentLockException extends RuntimeException {

    public DeploymentLockException(String message, Throwable cause) {
        super(message, cause);
    }
}
