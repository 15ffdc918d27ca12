package com.clustergate.gatekeeper.topology;

import com.clustergate.gatekeeper.validation.ValidationOutcome;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Checks a requested layout against a {@link RoleSchema}.
 *
 * Two failure modes with different shapes:
 * <ul>
 *   <li>an unknown role stops validation at that entry; later entries are never looked at</li>
 *   <li>missing critical roles are collected over the whole layout and reported together,
 *       in schema declaration order</li>
 * </ul>
 *
 * On success the outcome message is an HTML fragment listing each role and its
 * hosts in input order, ready to be shown on the confirmation page.
 */
@Component
public class TopologyValidator {

    static final String NOT_PROVIDED  = "ips.yaml configuration not provided";
    static final String UNKNOWN_ROLE  = "Unknown server role: ";
    static final String MISSING_ROLES = "Following required roles are not configured: ";

    public ValidationOutcome validate(TopologyRequest request, RoleSchema schema) {
        if (request == null || request.isEmpty()) {
            return ValidationOutcome.failure(NOT_PROVIDED);
        }

        Set<String> remaining = new LinkedHashSet<>(schema.criticalRoles());
        StringBuilder summary = new StringBuilder();

        for (Map.Entry<String, HostSpec> entry : request.roles().entrySet()) {
            String role = entry.getKey();
            if (!schema.isKnown(role)) {
                return ValidationOutcome.failure(UNKNOWN_ROLE + role);
            }
            remaining.removeAll(schema.covers(role));
            appendRoleBlock(summary, role, entry.getValue());
        }

        if (!remaining.isEmpty()) {
            return ValidationOutcome.failure(MISSING_ROLES + String.join(", ", remaining));
        }
        return ValidationOutcome.success(summary.toString());
    }

    private static void appendRoleBlock(StringBuilder summary, String role, HostSpec hosts) {
        summary.append("<p>").append(HtmlUtils.htmlEscape(role)).append("</p><ul>");
        for (String host : hosts.hosts()) {
            summary.append("<li>").append(HtmlUtils.htmlEscape(host)).append("</li>");
        }
        summary.append("</ul>");
    }
}
