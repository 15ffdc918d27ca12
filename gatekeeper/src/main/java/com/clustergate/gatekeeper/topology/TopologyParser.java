package com.clustergate.gatekeeper.topology;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns ips.yaml text into a {@link TopologyRequest}.
 *
 * Example input:
 * <pre>
 *   master: 192.168.1.2
 *   servers:
 *     - 192.168.1.3
 *     - 192.168.1.4
 * </pre>
 *
 * Only structure is checked here. Whether the role names make sense is the
 * validator's job.
 */
@Component
public class TopologyParser {

    private static final Logger log = LoggerFactory.getLogger(TopologyParser.class);

    static final String INVALID_YAML = "ips.yaml configuration is not valid YAML";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * @return the parsed layout; empty when the text is null or blank
     * @throws TopologyParseException if the text is not a YAML mapping of role → host(s)
     */
    public TopologyRequest parse(String ipsYaml) {
        if (ipsYaml == null || ipsYaml.isBlank()) {
            return TopologyRequest.empty();
        }

        JsonNode root;
        try {
            root = yamlMapper.readTree(ipsYaml);
        } catch (JsonProcessingException e) {
            log.debug("Rejected ips.yaml: {}", e.getOriginalMessage());
            throw new TopologyParseException(INVALID_YAML, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return TopologyRequest.empty();
        }
        if (!root.isObject()) {
            throw new TopologyParseException(INVALID_YAML);
        }

        Map<String, HostSpec> roles = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            roles.put(field.getKey(), toHostSpec(field.getKey(), field.getValue()));
        }
        return new TopologyRequest(roles);
    }

    private static HostSpec toHostSpec(String role, JsonNode value) {
        if (value == null || value.isNull()) {
            return HostSpec.many(List.of());
        }
        if (value.isArray()) {
            List<String> hosts = new ArrayList<>();
            for (JsonNode host : value) {
                if (!host.isValueNode()) {
                    throw new TopologyParseException("ips.yaml role '" + role + "' must list plain host names");
                }
                hosts.add(host.asText());
            }
            return HostSpec.many(hosts);
        }
        if (value.isValueNode()) {
            return HostSpec.single(value.asText());
        }
        throw new TopologyParseException("ips.yaml role '" + role + "' must map to a host or a list of hosts");
    }
}
