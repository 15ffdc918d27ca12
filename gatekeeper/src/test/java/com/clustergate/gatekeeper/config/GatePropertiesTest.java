package com.clustergate.gatekeeper.config;

import com.clustergate.gatekeeper.probe.ProbeScope;
import com.clustergate.gatekeeper.topology.RoleSchema;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Defaults and property binding for GateProperties.
 */
class GatePropertiesTest {

    @Test
    void defaults_matchBuiltInSettings() {
        GateProperties props = GateProperties.defaults();

        assertThat(props.schema().toRoleSchema()).isEqualTo(RoleSchema.standard());
        assertThat(props.lock().markerPath()).isEqualTo(Path.of(".", "clustergate.lock"));
        assertThat(props.probe().user()).isEqualTo("root");
        assertThat(props.probe().port()).isEqualTo(22);
        assertThat(props.probe().timeoutSeconds()).isEqualTo(10);
        assertThat(props.probe().scope()).isEqualTo(ProbeScope.FIRST_HOST);
        assertThat(props.probe().command()).isEqualTo("ls");
        assertThat(props.deploy().command()).containsExactly("appscale", "up");
        assertThat(props.deploy().workers()).isEqualTo(1);
        assertThat(props.deploy().workingDirectory()).isNull();
    }

    @Test
    void bind_overridesOnlyWhatIsSet() {
        MapConfigurationPropertySource source = new MapConfigurationPropertySource(Map.of(
                "clustergate.probe.scope",           "all-hosts",
                "clustergate.probe.timeout-seconds", "3",
                "clustergate.lock.directory",        "/var/run/clustergate",
                "clustergate.deploy.command",        "/opt/deploy/bin/up,--verbose"));

        GateProperties props = new Binder(source).bind("clustergate", GateProperties.class).get();

        assertThat(props.probe().scope()).isEqualTo(ProbeScope.ALL_HOSTS);
        assertThat(props.probe().timeoutSeconds()).isEqualTo(3);
        assertThat(props.probe().port()).isEqualTo(22);
        assertThat(props.lock().markerPath()).isEqualTo(Path.of("/var/run/clustergate/clustergate.lock"));
        assertThat(props.deploy().command()).containsExactly("/opt/deploy/bin/up", "--verbose");
        assertThat(props.schema().criticalRoles()).contains("appengine", "zookeeper");
    }

    @Test
    void bind_customSchema_replacesStandardRoles() {
        MapConfigurationPropertySource source = new MapConfigurationPropertySource(Map.of(
                "clustergate.schema.critical-roles[0]",        "api",
                "clustergate.schema.critical-roles[1]",        "db",
                "clustergate.schema.aggregate-roles.all[0]",   "api",
                "clustergate.schema.aggregate-roles.all[1]",   "db",
                "clustergate.schema.optional-roles[0]",        "cache"));

        RoleSchema schema = new Binder(source).bind("clustergate", GateProperties.class).get()
                .schema().toRoleSchema();

        assertThat(schema.criticalRoles()).containsExactly("api", "db");
        assertThat(schema.aggregateRoles()).containsOnlyKeys("all");
        assertThat(schema.isKnown("cache")).isTrue();
        assertThat(schema.isKnown("appengine")).isFalse();
        assertThat(List.copyOf(schema.aggregateRoles().get("all"))).containsExactly("api", "db");
    }
}
