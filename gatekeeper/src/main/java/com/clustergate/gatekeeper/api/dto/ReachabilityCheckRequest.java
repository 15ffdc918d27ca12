package com.clustergate.gatekeeper.api.dto;

/**
 * Request body for POST /gate/reachability.
 */
public record ReachabilityCheckRequest(String ipsYaml, String keyName, String rootPassword) {}
