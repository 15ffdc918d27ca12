package com.clustergate.gatekeeper.topology;

import com.clustergate.gatekeeper.validation.ValidationOutcome;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for TopologyValidator against the standard role schema.
 */
class TopologyValidatorTest {

    private final TopologyValidator validator = new TopologyValidator();
    private final RoleSchema        schema    = RoleSchema.standard();

    // ------------------------------------------------------------------
    // Complete layouts
    // ------------------------------------------------------------------

    @Test
    void masterPlusServers_coversEveryCriticalRole() {
        TopologyRequest request = TopologyRequest.builder()
                .single("master", "host1")
                .many("servers", List.of("host2", "host3"))
                .build();

        ValidationOutcome outcome = validator.validate(request, schema);

        assertThat(outcome.ok()).isTrue();
        assertThat(outcome.message()).isEqualTo(
                "<p>master</p><ul><li>host1</li></ul>"
              + "<p>servers</p><ul><li>host2</li><li>host3</li></ul>");
    }

    @Test
    void singleCriticalRoles_coverEverything() {
        TopologyRequest request = TopologyRequest.builder()
                .single("appengine", "a")
                .single("loadbalancer", "b")
                .single("database", "c")
                .single("login", "d")
                .single("shadow", "e")
                .single("zookeeper", "f")
                .single("memcache", "g")
                .build();

        assertThat(validator.validate(request, schema).ok()).isTrue();
    }

    @Test
    void controllerPlusAppengine_coversEverything() {
        TopologyRequest request = TopologyRequest.builder()
                .single("controller", "10.0.0.1")
                .many("appengine", List.of("10.0.0.2"))
                .build();

        assertThat(validator.validate(request, schema).ok()).isTrue();
    }

    @Test
    void summary_followsInputOrderNotSchemaOrder() {
        TopologyRequest request = TopologyRequest.builder()
                .many("servers", List.of("s1"))
                .single("open", "o1")
                .single("master", "m1")
                .build();

        String summary = validator.validate(request, schema).message();

        assertThat(summary.indexOf("<p>servers</p>")).isLessThan(summary.indexOf("<p>open</p>"));
        assertThat(summary.indexOf("<p>open</p>")).isLessThan(summary.indexOf("<p>master</p>"));
    }

    @Test
    void summary_escapesHtmlInHostNames() {
        TopologyRequest request = TopologyRequest.builder()
                .single("controller", "<b>x</b>")
                .single("appengine", "a")
                .build();

        assertThat(validator.validate(request, schema).message())
                .contains("<li>&lt;b&gt;x&lt;/b&gt;</li>");
    }

    // ------------------------------------------------------------------
    // Missing roles
    // ------------------------------------------------------------------

    @Test
    void masterAlone_reportsAppengineAndDatabase() {
        TopologyRequest request = TopologyRequest.builder().single("master", "host1").build();

        ValidationOutcome outcome = validator.validate(request, schema);

        assertThat(outcome.ok()).isFalse();
        assertThat(outcome.message())
                .isEqualTo("Following required roles are not configured: appengine, database");
    }

    @Test
    void missingRoles_listedInSchemaOrder() {
        // only optional roles: every critical role is missing
        TopologyRequest request = TopologyRequest.builder().single("open", "h").build();

        assertThat(validator.validate(request, schema).message()).isEqualTo(
                "Following required roles are not configured: "
              + "appengine, loadbalancer, database, login, shadow, zookeeper");
    }

    @Test
    void singleMissingRole_noTrailingSeparator() {
        TopologyRequest request = TopologyRequest.builder()
                .single("master", "m")
                .single("database", "d")
                .build();

        assertThat(validator.validate(request, schema).message())
                .isEqualTo("Following required roles are not configured: appengine");
    }

    // ------------------------------------------------------------------
    // Unknown roles
    // ------------------------------------------------------------------

    @Test
    void unknownRole_failsWithItsName() {
        TopologyRequest request = TopologyRequest.builder()
                .single("master", "m")
                .single("webserver", "w")
                .build();

        ValidationOutcome outcome = validator.validate(request, schema);

        assertThat(outcome.ok()).isFalse();
        assertThat(outcome.message()).isEqualTo("Unknown server role: webserver");
    }

    @Test
    void unknownRole_stopsBeforeLaterEntries() {
        // a complete layout except for the bad role in the middle
        TopologyRequest request = TopologyRequest.builder()
                .single("master", "m")
                .single("bogus", "x")
                .many("servers", List.of("s1"))
                .build();

        ValidationOutcome outcome = validator.validate(request, schema);

        assertThat(outcome.message()).isEqualTo("Unknown server role: bogus");
        assertThat(outcome.message()).doesNotContain("servers");
    }

    @Test
    void unknownRole_winsOverMissingRoles() {
        TopologyRequest request = TopologyRequest.builder().single("nosuchrole", "x").build();

        assertThat(validator.validate(request, schema).message())
                .isEqualTo("Unknown server role: nosuchrole");
    }

    // ------------------------------------------------------------------
    // Empty input
    // ------------------------------------------------------------------

    @Test
    void emptyOrNullRequest_notProvided() {
        assertThat(validator.validate(TopologyRequest.empty(), schema).message())
                .isEqualTo("ips.yaml configuration not provided");
        assertThat(validator.validate(null, schema).message())
                .isEqualTo("ips.yaml configuration not provided");
    }

    // ------------------------------------------------------------------
    // Custom schema
    // ------------------------------------------------------------------

    @Test
    void customSchema_aggregateCoversItsRoles() {
        Map<String, Set<String>> aggregates = new LinkedHashMap<>();
        aggregates.put("allinone", Set.of("api", "db"));
        RoleSchema custom = new RoleSchema(Set.of("api", "db"), aggregates, Set.of());

        assertThat(validator.validate(
                TopologyRequest.builder().single("allinone", "h").build(), custom).ok()).isTrue();
        assertThat(validator.validate(
                TopologyRequest.builder().single("api", "h").build(), custom).message())
                .isEqualTo("Following required roles are not configured: db");
    }

    @Test
    void validate_doesNotMutateSchema() {
        validator.validate(TopologyRequest.builder().single("master", "m").build(), schema);

        assertThat(schema.criticalRoles()).hasSize(6);
    }
}
