package com.clustergate.gatekeeper.service;

import java.util.UUID;

/**
 * The gate's answer to a deployment request.
 *
 * @param admitted     true if the deployment was started
 * @param stage        the stage that decided: the failing one, or LAUNCH when admitted
 * @param category     failure category, null when admitted
 * @param message      operator-facing text
 * @param deploymentId id of the started deployment, null when rejected
 */
public record AdmissionDecision(
        boolean         admitted,
        AdmissionStage  stage,
        FailureCategory category,
        String          message,
        UUID            deploymentId
) {
    public static AdmissionDecision admitted(UUID deploymentId) {
        return new AdmissionDecision(true, AdmissionStage.LAUNCH, null, "Deployment started", deploymentId);
    }

    public static AdmissionDecision rejected(AdmissionStage stage, FailureCategory category, String message) {
        return new AdmissionDecision(false, stage, category, message, null);
    }
}
