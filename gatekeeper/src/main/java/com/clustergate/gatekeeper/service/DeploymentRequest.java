package com.clustergate.gatekeeper.service;

/**
 * A full deployment request as the operator submitted it.
 * Nothing here has been validated yet.
 */
public record DeploymentRequest(
        String adminUser,
        String adminPassword,
        String adminPasswordConfirm,
        String keyName,
        String rootPassword,
        String ipsYaml
) {
    @Override
    public String toString() {
        return "DeploymentRequest[adminUser=" + adminUser + ", keyName=" + keyName + "]";
    }
}
