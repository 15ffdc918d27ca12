package com.clustergate.gatekeeper.api.dto;

/**
 * Request body for POST /gate/credentials.
 */
public record CredentialsCheckRequest(String username, String password, String passwordConfirm) {}
