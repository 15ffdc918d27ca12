package com.clustergate.gatekeeper.config;

import com.clustergate.gatekeeper.probe.ProbeScope;
import com.clustergate.gatekeeper.topology.RoleSchema;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything under {@code clustergate.*} in application.yml.
 *
 * Each section falls back to the built-in defaults when it is omitted, so a
 * bare {@code new GateProperties(null, null, null, null)} is a working setup
 * (used by unit tests that don't start Spring).
 */
@ConfigurationProperties(prefix = "clustergate")
public record GateProperties(Schema schema, Lock lock, Probe probe, Deploy deploy) {

    public GateProperties {
        if (schema == null) schema = new Schema(null, null, null);
        if (lock   == null) lock   = new Lock(null, null);
        if (probe  == null) probe  = new Probe(null, 0, 0, null, null);
        if (deploy == null) deploy = new Deploy(null, null, null, 0);
    }

    public static GateProperties defaults() {
        return new GateProperties(null, null, null, null);
    }

    // ------------------------------------------------------------------
    // Role schema
    // ------------------------------------------------------------------

    /**
     * Role names accepted in ips.yaml.
     *
     * @param criticalRoles  roles every topology must cover; declaration order is
     *                       the order missing roles are reported in
     * @param aggregateRoles shorthand role → critical roles it covers
     * @param optionalRoles  accepted but never required
     */
    public record Schema(List<String>              criticalRoles,
                         Map<String, List<String>> aggregateRoles,
                         List<String>              optionalRoles) {

        public Schema {
            RoleSchema standard = RoleSchema.standard();
            if (criticalRoles == null || criticalRoles.isEmpty()) {
                criticalRoles = List.copyOf(standard.criticalRoles());
            }
            if (aggregateRoles == null) {
                Map<String, List<String>> copy = new LinkedHashMap<>();
                standard.aggregateRoles().forEach((k, v) -> copy.put(k, List.copyOf(v)));
                aggregateRoles = copy;
            }
            if (optionalRoles == null) {
                optionalRoles = List.copyOf(standard.optionalRoles());
            }
        }

        public RoleSchema toRoleSchema() {
            Map<String, Set<String>> aggregates = new LinkedHashMap<>();
            aggregateRoles.forEach((role, implied) -> aggregates.put(role, new LinkedHashSet<>(implied)));
            return new RoleSchema(new LinkedHashSet<>(criticalRoles), aggregates, new LinkedHashSet<>(optionalRoles));
        }
    }

    // ------------------------------------------------------------------
    // Deployment lock
    // ------------------------------------------------------------------

    /**
     * @param directory where the marker lives (default: working directory)
     * @param fileName  marker file name (default: clustergate.lock)
     */
    public record Lock(String directory, String fileName) {

        public Lock {
            if (directory == null || directory.isBlank()) directory = ".";
            if (fileName  == null || fileName.isBlank())  fileName  = "clustergate.lock";
        }

        public Path markerPath() {
            return Path.of(directory).resolve(fileName);
        }
    }

    // ------------------------------------------------------------------
    // Remote preflight probe
    // ------------------------------------------------------------------

    /**
     * @param user           privileged account the probe logs in as
     * @param port           SSH port on every host
     * @param timeoutSeconds wall-clock bound for one probe attempt
     * @param scope          probe the first resolved host, or every host
     * @param command        no-op command run once the session is up
     */
    public record Probe(String user, int port, int timeoutSeconds, ProbeScope scope, String command) {

        public Probe {
            if (user == null || user.isBlank())       user = "root";
            if (port <= 0)                            port = 22;
            if (timeoutSeconds <= 0)                  timeoutSeconds = 10;
            if (scope == null)                        scope = ProbeScope.FIRST_HOST;
            if (command == null || command.isBlank()) command = "ls";
        }
    }

    // ------------------------------------------------------------------
    // External deployment engine
    // ------------------------------------------------------------------

    /**
     * @param command          argv of the external deployment tool
     * @param logDirectory     where deploy-{timestamp}.log and ips-{id}.yaml are written
     * @param workingDirectory cwd for the command (null = inherit)
     * @param workers          size of the deployment worker pool
     */
    public record Deploy(List<String> command, String logDirectory, String workingDirectory, int workers) {

        public Deploy {
            if (command == null || command.isEmpty())       command = List.of("appscale", "up");
            if (logDirectory == null || logDirectory.isBlank()) logDirectory = "logs";
            if (workingDirectory != null && workingDirectory.isBlank()) workingDirectory = null;
            if (workers <= 0)                                workers = 1;
            command = List.copyOf(command);
        }
    }
}
