package com.clustergate.gatekeeper.topology;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The three role classes a topology may use.
 *
 * <ul>
 *   <li>critical: each must be covered by some entry, directly or through an aggregate</li>
 *   <li>aggregate: shorthand names that cover several critical roles at once</li>
 *   <li>optional: accepted, never required</li>
 * </ul>
 *
 * Immutable. Iteration order of {@link #criticalRoles()} is declaration order.
 */
public record RoleSchema(Set<String>              criticalRoles,
                         Map<String, Set<String>> aggregateRoles,
                         Set<String>              optionalRoles) {

    public RoleSchema {
        criticalRoles = Collections.unmodifiableSet(new LinkedHashSet<>(criticalRoles));
        Map<String, Set<String>> aggregates = new LinkedHashMap<>();
        aggregateRoles.forEach((role, implied) ->
                aggregates.put(role, Collections.unmodifiableSet(new LinkedHashSet<>(implied))));
        aggregateRoles = Collections.unmodifiableMap(aggregates);
        optionalRoles = Collections.unmodifiableSet(new LinkedHashSet<>(optionalRoles));
    }

    /** The layout vocabulary of a standard AppScale-style deployment. */
    public static RoleSchema standard() {
        Map<String, Set<String>> aggregates = new LinkedHashMap<>();
        aggregates.put("master",     orderedSet("shadow", "loadbalancer", "zookeeper", "login"));
        aggregates.put("controller", orderedSet("shadow", "loadbalancer", "zookeeper", "database", "login"));
        aggregates.put("servers",    orderedSet("appengine", "database", "loadbalancer"));
        return new RoleSchema(
                orderedSet("appengine", "loadbalancer", "database", "login", "shadow", "zookeeper"),
                aggregates,
                orderedSet("open", "memcache"));
    }

    public boolean isKnown(String role) {
        return criticalRoles.contains(role)
            || aggregateRoles.containsKey(role)
            || optionalRoles.contains(role);
    }

    /** Critical roles satisfied by assigning {@code role}: itself if critical, plus anything it aggregates. */
    public Set<String> covers(String role) {
        Set<String> covered = new LinkedHashSet<>();
        if (criticalRoles.contains(role)) {
            covered.add(role);
        }
        covered.addAll(aggregateRoles.getOrDefault(role, Set.of()));
        return covered;
    }

    private static Set<String> orderedSet(String... roles) {
        return new LinkedHashSet<>(List.of(roles));
    }
}
