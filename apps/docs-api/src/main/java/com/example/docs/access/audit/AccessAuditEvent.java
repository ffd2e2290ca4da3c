package com.example.docs.access.audit;

import com.example.docs.access.model.AccessDecision;
import com.example.docs.access.model.MethodClass;
import com.example.docs.access.model.ShareableResource;
import com.example.docs.security.context.AuthContext;

import java.time.Instant;
import java.util.Map;

/**
 * Structured audit event for a single access decision.
 */
public record AccessAuditEvent(
        // Event metadata
        Instant timestamp,
        String correlationId,

        // Decision
        Outcome outcome,
        String rule,
        String reason,
        boolean adminPrivateView,

        // Subject
        String userId,
        String workspaceSlug,

        // Resource
        String resourceKind,
        String resourceId,
        String resourceAccess,

        MethodClass methodClass,

        // Request context
        String path,
        String method,
        String clientIp,
        String userAgent
) {
    public enum Outcome {
        ALLOW, DENY
    }

    public static AccessAuditEvent from(
            AuthContext requester,
            String workspaceSlug,
            ShareableResource resource,
            MethodClass methodClass,
            AccessDecision decision,
            RequestContext requestContext) {

        return new AccessAuditEvent(
                Instant.now(),
                requestContext.correlationId(),
                decision.isAllowed() ? Outcome.ALLOW : Outcome.DENY,
                decision.rule(),
                decision.reason() != null ? decision.reason().name() : null,
                decision.adminPrivateView(),
                requester != null ? requester.userId() : null,
                workspaceSlug,
                resource != null ? resource.kind().name() : "COLLECTION",
                resource != null ? resource.getId() : null,
                resource != null && resource.getAccess() != null ? resource.getAccess().name() : null,
                methodClass,
                requestContext.path(),
                requestContext.method(),
                requestContext.clientIp(),
                requestContext.userAgent()
        );
    }

    /**
     * Flattens the event for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "access_decision"),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("correlation_id", orEmpty(correlationId)),
                Map.entry("outcome", outcome.name()),
                Map.entry("rule", orEmpty(rule)),
                Map.entry("reason", orEmpty(reason)),
                Map.entry("admin_private_view", adminPrivateView),
                Map.entry("user_id", orEmpty(userId)),
                Map.entry("workspace", orEmpty(workspaceSlug)),
                Map.entry("resource_kind", orEmpty(resourceKind)),
                Map.entry("resource_id", orEmpty(resourceId)),
                Map.entry("resource_access", orEmpty(resourceAccess)),
                Map.entry("method_class", methodClass != null ? methodClass.name() : ""),
                Map.entry("path", orEmpty(path)),
                Map.entry("method", orEmpty(method)),
                Map.entry("client_ip", orEmpty(clientIp)),
                Map.entry("user_agent", orEmpty(userAgent))
        );
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    public record RequestContext(
            String correlationId,
            String path,
            String method,
            String clientIp,
            String userAgent
    ) {
        public static RequestContext empty() {
            return new RequestContext(null, null, null, null, null);
        }
    }
}
