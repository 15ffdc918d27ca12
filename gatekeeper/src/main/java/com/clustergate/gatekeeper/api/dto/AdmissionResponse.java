package com.clustergate.gatekeeper.api.dto;

import com.clustergate.gatekeeper.service.AdmissionDecision;
import com.clustergate.gatekeeper.service.AdmissionStage;
import com.clustergate.gatekeeper.service.FailureCategory;

import java.util.UUID;

/**
 * Response body for POST /deployments.
 * On success {@code deploymentId} is what the caller polls GET /deployments/{id} with.
 */
public record AdmissionResponse(
        boolean         admitted,
        AdmissionStage  stage,
        FailureCategory category,
        String          message,
        UUID            deploymentId
) {
    public static AdmissionResponse from(AdmissionDecision decision) {
        return new AdmissionResponse(
                decision.admitted(),
                decision.stage(),
                decision.category(),
                decision.message(),
                decision.deploymentId()
        );
    }
}
