package com.clustergate.gatekeeper.topology;

import java.util.List;
import java.util.Objects;

/**
 * The value side of an ips.yaml entry: a role is assigned either one host
 * or a list of hosts. Callers go through {@link #hosts()} and never need to
 * care which form was written.
 */
public sealed interface HostSpec permits HostSpec.Single, HostSpec.Many {

    /** Hosts in the order they were written. */
    List<String> hosts();

    static HostSpec single(String host) {
        return new Single(host);
    }

    static HostSpec many(List<String> hosts) {
        return new Many(hosts);
    }

    record Single(String host) implements HostSpec {

        public Single {
            Objects.requireNonNull(host, "host");
        }

        @Override
        public List<String> hosts() {
            return List.of(host);
        }
    }

    record Many(List<String> hosts) implements HostSpec {

        public Many {
            hosts = List.copyOf(hosts);
        }
    }
}
