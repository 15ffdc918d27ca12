package com.clustergate.gatekeeper.deploy;

import java.util.UUID;

/**
 * Everything the external deployment tool needs for one run.
 *
 * @param deploymentId id of the deployment record this run belongs to
 * @param keyName      name of the cluster key pair
 * @param adminUser    administrator account to create on the cluster
 * @param adminPassword password for {@code adminUser}
 * @param rootPassword root password of the target machines
 * @param ipsYaml      the validated layout, as the operator submitted it
 */
public record DeploymentOptions(
        UUID   deploymentId,
        String keyName,
        String adminUser,
        String adminPassword,
        String rootPassword,
        String ipsYaml
) {
    // Passwords stay out of logs.
    @Override
    public String toString() {
        return "DeploymentOptions[deploymentId=" + deploymentId
                + ", keyName=" + keyName
                + ", adminUser=" + adminUser + "]";
    }
}
