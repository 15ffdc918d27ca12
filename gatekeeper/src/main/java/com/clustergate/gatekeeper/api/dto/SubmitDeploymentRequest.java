package com.clustergate.gatekeeper.api.dto;

import com.clustergate.gatekeeper.service.DeploymentRequest;

/**
 * Request body for POST /deployments.
 *
 * Nothing is required at the JSON level: missing fields come through as null
 * and the gate reports them with the same messages as the stage endpoints.
 */
public record SubmitDeploymentRequest(
        String adminUser,
        String adminPassword,
        String adminPasswordConfirm,
        String keyName,
        String rootPassword,
        String ipsYaml
) {
    public DeploymentRequest toDeploymentRequest() {
        return new DeploymentRequest(adminUser, adminPassword, adminPasswordConfirm,
                keyName, rootPassword, ipsYaml);
    }

    @Override
    public String toString() {
        return "SubmitDeploymentRequest[adminUser=" + adminUser + ", keyName=" + keyName + "]";
    }
}
