package com.clustergate.gatekeeper.topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A requested cluster layout: role name → host(s), in the order the operator
 * wrote them. Role names are free text here; only {@link TopologyValidator}
 * decides whether they mean anything.
 */
public record TopologyRequest(Map<String, HostSpec> roles) {

    public TopologyRequest {
        roles = roles == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(roles));
    }

    public static TopologyRequest empty() {
        return new TopologyRequest(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return roles.isEmpty();
    }

    /**
     * Every host named anywhere in the layout, first occurrence wins.
     * This is the node list the reachability probe samples from.
     */
    public List<String> distinctHosts() {
        Set<String> seen = new LinkedHashSet<>();
        roles.values().forEach(spec -> seen.addAll(spec.hosts()));
        return new ArrayList<>(seen);
    }

    public static final class Builder {

        private final Map<String, HostSpec> roles = new LinkedHashMap<>();

        private Builder() {}

        public Builder single(String role, String host) {
            roles.put(role, HostSpec.single(host));
            return this;
        }

        public Builder many(String role, List<String> hosts) {
            roles.put(role, HostSpec.many(hosts));
            return this;
        }

        public TopologyRequest build() {
            return new TopologyRequest(roles);
        }
    }
}
