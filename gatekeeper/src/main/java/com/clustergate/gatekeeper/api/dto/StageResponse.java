package com.clustergate.gatekeeper.api.dto;

import com.clustergate.gatekeeper.validation.ValidationOutcome;

/**
 * Response body for every /gate stage endpoint: whether the check passed and
 * the message to show the operator.
 */
public record StageResponse(boolean ok, String message) {

    public static StageResponse from(ValidationOutcome outcome) {
        return new StageResponse(outcome.ok(), outcome.message());
    }
}
