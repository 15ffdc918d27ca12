package com.clustergate.gatekeeper.api.dto;

/**
 * Request body for POST /gate/topology. {@code ipsYaml} is the raw ips.yaml text.
 */
public record TopologyCheckRequest(String ipsYaml) {}
