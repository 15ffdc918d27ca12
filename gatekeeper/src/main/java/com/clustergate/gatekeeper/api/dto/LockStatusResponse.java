package com.clustergate.gatekeeper.api.dto;

/**
 * Response body for GET /gate/lock.
 */
public record LockStatusResponse(boolean locked) {}
