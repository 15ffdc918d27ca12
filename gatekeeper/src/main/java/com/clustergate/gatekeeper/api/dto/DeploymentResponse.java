package com.clustergate.gatekeeper.api.dto;

import com.clustergate.gatekeeper.model.Deployment;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for GET /deployments and GET /deployments/{id}.
 */
public record DeploymentResponse(
        UUID    id,
        String  state,
        String  keyName,
        String  adminUser,
        String  topologySummary,
        String  logFile,
        Integer exitCode,
        String  message,
        Instant createdAt,
        Instant updatedAt,
        Instant finishedAt
) {
    public static DeploymentResponse from(Deployment d) {
        return new DeploymentResponse(
                d.getId(),
                d.getState().name(),
                d.getKeyName(),
                d.getAdminUser(),
                d.getTopologySummary(),
                d.getLogFile(),
                d.getExitCode(),
                d.getMessage(),
                d.getCreatedAt(),
                d.getUpdatedAt(),
                d.getFinishedAt()
        );
    }
}
