package com.example.docs.access.service;

import com.example.docs.access.audit.AccessAuditService;
import com.example.docs.access.engine.AccessEvaluator;
import com.example.docs.access.engine.ShareLookup;
import com.example.docs.access.model.AccessDecision;
import com.example.docs.access.model.DenyReason;
import com.example.docs.access.model.MethodClass;
import com.example.docs.access.model.ShareableResource;
import com.example.docs.observability.metrics.AccessMetrics;
import com.example.docs.security.context.AuthContext;
import com.example.docs.security.exception.AuthenticationException;
import com.example.docs.security.exception.AuthorizationException;
import com.example.docs.workspace.model.WorkspaceMembership;
import com.example.docs.workspace.service.WorkspaceMembershipService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Entry point for every access check. Looks up the caller's membership, runs the
 * {@link AccessEvaluator}, and records the decision in metrics and the audit log.
 *
 * <p>The {@code authorize} methods return the decision. The {@code require} methods turn a
 * deny into an error signal: {@link AuthenticationException} for anonymous callers,
 * {@link AuthorizationException} for everything else.
 */
@Slf4j
@Service
public class ResourceAuthorizationService {

    private final AccessEvaluator evaluator;
    private final WorkspaceMembershipService membershipService;
    private final AccessAuditService auditService;
    private final AccessMetrics metrics;

    public ResourceAuthorizationService(
            AccessEvaluator evaluator,
            WorkspaceMembershipService membershipService,
            AccessAuditService auditService,
            AccessMetrics metrics) {
        this.evaluator = evaluator;
        this.membershipService = membershipService;
        this.auditService = auditService;
        this.metrics = metrics;
    }

    /**
     * Coarse check. Emits the caller's active membership in {@code workspaceSlug}, or an error.
     */
    public Mono<WorkspaceMembership> requireMembership(
            @Nullable AuthContext requester,
            String workspaceSlug,
            MethodClass methodClass,
            @Nullable ServerHttpRequest request) {
        return checkMembership(requester, workspaceSlug, methodClass, request, true);
    }

    /**
     * Coarse check ahead of a resource check. Only denials are recorded here; the resource
     * decision that follows is recorded by {@link #authorize}.
     */
    public Mono<WorkspaceMembership> requireMembershipForResource(
            @Nullable AuthContext requester,
            String workspaceSlug,
            MethodClass methodClass,
            @Nullable ServerHttpRequest request) {
        return checkMembership(requester, workspaceSlug, methodClass, request, false);
    }

    /**
     * Full check for a resource already loaded within the caller's workspace.
     */
    public Mono<AccessDecision> authorize(
            @Nullable AuthContext requester,
            @Nullable WorkspaceMembership membership,
            ShareableResource resource,
            MethodClass methodClass,
            ShareLookup shareLookup,
            @Nullable ServerHttpRequest request) {

        String slug = membership != null ? membership.workspaceSlug() : "";
        return evaluator.evaluate(requester, membership, resource, methodClass, shareLookup)
                .doOnNext(decision -> record(requester, slug, resource, methodClass, decision, request));
    }

    public Mono<AccessDecision> require(
            @Nullable AuthContext requester,
            @Nullable WorkspaceMembership membership,
            ShareableResource resource,
            MethodClass methodClass,
            ShareLookup shareLookup,
            @Nullable ServerHttpRequest request) {

        return authorize(requester, membership, resource, methodClass, shareLookup, request)
                .flatMap(decision -> decision.isAllowed()
                        ? Mono.just(decision)
                        : Mono.error(toException(decision)));
    }

    /**
     * Collection-level check. Emits the membership when allowed.
     */
    public Mono<WorkspaceMembership> requireCollectionAccess(
            @Nullable AuthContext requester,
            String workspaceSlug,
            MethodClass methodClass,
            @Nullable ServerHttpRequest request) {

        return lookupMembership(requester, workspaceSlug)
                .flatMap(membership -> {
                    AccessDecision decision = evaluator.evaluateCollection(
                            requester, membership.orElse(null), methodClass);
                    record(requester, workspaceSlug, null, methodClass, decision, request);
                    if (decision.isDenied()) {
                        return Mono.error(toException(decision));
                    }
                    return Mono.just(membership.get());
                });
    }

    private Mono<WorkspaceMembership> checkMembership(
            @Nullable AuthContext requester,
            String workspaceSlug,
            MethodClass methodClass,
            @Nullable ServerHttpRequest request,
            boolean recordAllow) {

        return lookupMembership(requester, workspaceSlug)
                .flatMap(membership -> {
                    AccessDecision decision = evaluator.checkMembership(requester, membership.orElse(null));
                    if (decision.isDenied() || recordAllow) {
                        record(requester, workspaceSlug, null, methodClass, decision, request);
                    }
                    if (decision.isDenied()) {
                        return Mono.error(toException(decision));
                    }
                    return Mono.just(membership.get());
                });
    }

    private Mono<Optional<WorkspaceMembership>> lookupMembership(
            @Nullable AuthContext requester, String workspaceSlug) {
        if (requester == null) {
            return Mono.just(Optional.empty());
        }
        return membershipService.findActiveMembership(requester.userId(), workspaceSlug)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    private void record(
            @Nullable AuthContext requester,
            String workspaceSlug,
            @Nullable ShareableResource resource,
            MethodClass methodClass,
            AccessDecision decision,
            @Nullable ServerHttpRequest request) {
        metrics.recordDecision(decision);
        auditService.logDecision(requester, workspaceSlug, resource, methodClass, decision, request);
    }

    private RuntimeException toException(AccessDecision decision) {
        if (decision.reason() == DenyReason.UNAUTHENTICATED) {
            return new AuthenticationException("Authentication required");
        }
        return new AuthorizationException(decision);
    }
}
