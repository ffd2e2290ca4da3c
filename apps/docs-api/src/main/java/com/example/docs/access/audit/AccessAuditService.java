package com.example.docs.access.audit;

import com.example.docs.access.document.AccessLogDoc;
import com.example.docs.access.model.AccessDecision;
import com.example.docs.access.model.AccessType;
import com.example.docs.access.model.MethodClass;
import com.example.docs.access.model.ShareableResource;
import com.example.docs.access.repository.AccessLogRepository;
import com.example.docs.common.util.ClientIpExtractor;
import com.example.docs.common.util.StringSanitizer;
import com.example.docs.config.properties.DocsProperties;
import com.example.docs.observability.filter.CorrelationIdFilter;
import com.example.docs.security.context.AuthContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Writes the access trail: one structured JSON line per decision on the {@code ACCESS_AUDIT} logger,
 * and a persisted {@link AccessLogDoc} per completed access.
 */
@Service
public class AccessAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("ACCESS_AUDIT");

    private static final String HEADER_USER_AGENT = "User-Agent";
    private static final int MAX_PATH_LENGTH = 2000;

    private final AccessLogRepository accessLogRepository;
    private final ObjectMapper objectMapper;
    private final DocsProperties.AuditProperties auditProperties;

    public AccessAuditService(
            AccessLogRepository accessLogRepository,
            ObjectMapper objectMapper,
            DocsProperties properties) {
        this.accessLogRepository = accessLogRepository;
        this.objectMapper = objectMapper;
        this.auditProperties = properties.audit();
    }

    public void logDecision(
            @Nullable AuthContext requester,
            @NonNull String workspaceSlug,
            @Nullable ShareableResource resource,
            @NonNull MethodClass methodClass,
            @NonNull AccessDecision decision,
            @Nullable ServerHttpRequest request) {

        if (!auditProperties.structuredLogEnabled()) {
            return;
        }

        AccessAuditEvent event = AccessAuditEvent.from(
                requester, workspaceSlug, resource, methodClass, decision, extractRequestContext(request));

        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            if (event.outcome() == AccessAuditEvent.Outcome.ALLOW) {
                AUDIT_LOG.info(json);
            } else {
                AUDIT_LOG.warn(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            AUDIT_LOG.warn("Access {} - user={}, resource={}/{}, rule={}, reason={}",
                    event.outcome(),
                    StringSanitizer.forLog(event.userId()),
                    event.resourceKind(),
                    StringSanitizer.forLog(event.resourceId()),
                    event.rule(),
                    event.reason());
        }
    }

    /**
     * Persists an access-log entry. Errors propagate so callers can fail the request when the
     * entry is mandatory.
     */
    public Mono<AccessLogDoc> record(
            @NonNull AccessType accessType,
            @NonNull ShareableResource resource,
            @NonNull AuthContext requester,
            @Nullable ServerHttpRequest request,
            @Nullable Map<String, Object> metadata) {

        AccessLogDoc entry = AccessLogDoc.builder()
                .resourceKind(resource.kind())
                .resourceId(resource.getId())
                .workspaceId(resource.getWorkspaceId())
                .userId(requester.userId())
                .accessType(accessType)
                .ipAddress(ClientIpExtractor.extract(request))
                .userAgent(extractUserAgent(request))
                .metadata(metadata != null ? metadata : Map.of())
                .build();

        return accessLogRepository.save(entry)
                .doOnNext(saved -> AUDIT_LOG.debug("Recorded {} on {} {} by {}",
                        accessType.value(), resource.kind(),
                        StringSanitizer.forLog(resource.getId()),
                        StringSanitizer.forLog(requester.userId())));
    }

    public Flux<AccessLogDoc> history(@NonNull ShareableResource resource) {
        return accessLogRepository.findByResourceKindAndResourceIdOrderByCreatedAtDesc(
                resource.kind(), resource.getId());
    }

    @NonNull
    private AccessAuditEvent.RequestContext extractRequestContext(@Nullable ServerHttpRequest request) {
        if (request == null) {
            return AccessAuditEvent.RequestContext.empty();
        }

        String path = StringSanitizer.truncate(request.getPath().value(), MAX_PATH_LENGTH);
        String method = request.getMethod() != null ? request.getMethod().name() : "UNKNOWN";

        return new AccessAuditEvent.RequestContext(
                StringSanitizer.truncate(
                        request.getHeaders().getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER), 64),
                path,
                method,
                ClientIpExtractor.extract(request),
                extractUserAgent(request)
        );
    }

    @Nullable
    private String extractUserAgent(@Nullable ServerHttpRequest request) {
        if (request == null) {
            return null;
        }
        String userAgent = request.getHeaders().getFirst(HEADER_USER_AGENT);
        if (userAgent == null || userAgent.isBlank()) {
            return null;
        }
        return StringSanitizer.truncate(userAgent, auditProperties.maxUserAgentLength());
    }
}
