package com.example.docs.access.engine;

import com.example.docs.access.model.AccessDecision;
import com.example.docs.access.model.DenyReason;
import com.example.docs.access.model.MethodClass;
import com.example.docs.access.model.ShareableResource;
import com.example.docs.access.model.SharePermission;
import com.example.docs.access.model.WorkspaceRole;
import com.example.docs.common.util.StringSanitizer;
import com.example.docs.security.context.AuthContext;
import com.example.docs.workspace.model.WorkspaceMembership;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Decides whether a requester may read or change a document, wiki page or collection.
 *
 * <p>Decision order for a single resource:
 * <ol>
 *   <li>anonymous requester: deny</li>
 *   <li>no active membership in the workspace: deny, even for the owner</li>
 *   <li>missing owner or access level: deny (fail closed)</li>
 *   <li>owner: allow</li>
 *   <li>PRIVATE: admins may read (flagged for audit), everyone else is denied</li>
 *   <li>SHARED: a share grants read, EDIT/ADMIN shares grant write; without a share only admins may read</li>
 *   <li>PUBLIC: deny, public sharing is disabled</li>
 * </ol>
 *
 * <p>Stateless. The only lookup it issues is the share lookup, and only for SHARED resources.
 */
@Slf4j
@Component
public class AccessEvaluator {

    static final String RULE_AUTHENTICATED = "AUTHENTICATED";
    static final String RULE_WORKSPACE_MEMBER = "WORKSPACE_MEMBER";
    static final String RULE_OWNER = "OWNER";
    static final String RULE_PRIVATE = "PRIVATE_ACCESS";
    static final String RULE_ADMIN_PRIVATE_VIEW = "ADMIN_PRIVATE_VIEW";
    static final String RULE_SHARE = "SHARE";
    static final String RULE_ADMIN_SHARED_VIEW = "ADMIN_SHARED_VIEW";
    static final String RULE_PUBLIC_DISABLED = "PUBLIC_DISABLED";
    static final String RULE_MISCONFIGURED = "MISCONFIGURED";
    static final String RULE_COLLECTION = "COLLECTION_ROLE";

    /**
     * Coarse check applied to every request before any resource is loaded.
     */
    public AccessDecision checkMembership(@Nullable AuthContext requester, @Nullable WorkspaceMembership membership) {
        if (requester == null) {
            return AccessDecision.deny(RULE_AUTHENTICATED, DenyReason.UNAUTHENTICATED);
        }
        if (membership == null || !requester.userId().equals(membership.userId())) {
            return AccessDecision.deny(RULE_WORKSPACE_MEMBER, DenyReason.NOT_A_WORKSPACE_MEMBER);
        }
        return AccessDecision.allow(RULE_WORKSPACE_MEMBER);
    }

    /**
     * Full evaluation for a single document or wiki page.
     *
     * @param requester   the caller, {@code null} when anonymous
     * @param membership  the caller's active membership in the request's workspace, {@code null} when absent
     * @param resource    the resource being accessed
     * @param methodClass read or write
     * @param shareLookup share store for the resource's kind
     */
    public Mono<AccessDecision> evaluate(
            @Nullable AuthContext requester,
            @Nullable WorkspaceMembership membership,
            ShareableResource resource,
            MethodClass methodClass,
            ShareLookup shareLookup) {

        AccessDecision coarse = checkMembership(requester, membership);
        if (coarse.isDenied()) {
            return Mono.just(coarse);
        }

        if (resource.getOwnedBy() == null || resource.getAccess() == null) {
            log.warn("Misconfigured {} {}: owner={}, access={}. Denying.",
                    resource.kind(), StringSanitizer.forLog(resource.getId()),
                    StringSanitizer.forLog(resource.getOwnedBy()), resource.getAccess());
            return Mono.just(AccessDecision.deny(RULE_MISCONFIGURED, DenyReason.MISCONFIGURED));
        }

        String userId = requester.userId();
        if (userId.equals(resource.getOwnedBy())) {
            return Mono.just(AccessDecision.allow(RULE_OWNER));
        }

        boolean isAdmin = membership.role().isAdmin()
                && membership.workspaceId().equals(resource.getWorkspaceId());

        return switch (resource.getAccess()) {
            case PRIVATE -> Mono.just(decidePrivate(isAdmin, methodClass));
            case SHARED -> shareLookup.findActiveShare(resource.getId(), userId)
                    .map(permission -> decideWithShare(permission, methodClass))
                    .switchIfEmpty(Mono.fromSupplier(() -> decideWithoutShare(isAdmin, methodClass)));
            case PUBLIC -> Mono.just(AccessDecision.deny(RULE_PUBLIC_DISABLED, DenyReason.PUBLIC_ACCESS_DISABLED));
        };
    }

    /**
     * Collection-level rule: any member may read, only MEMBER and ADMIN may write.
     */
    public AccessDecision evaluateCollection(
            @Nullable AuthContext requester,
            @Nullable WorkspaceMembership membership,
            MethodClass methodClass) {

        AccessDecision coarse = checkMembership(requester, membership);
        if (coarse.isDenied() || methodClass == MethodClass.SAFE) {
            return coarse;
        }
        if (membership.role().isAtLeast(WorkspaceRole.MEMBER)) {
            return AccessDecision.allow(RULE_COLLECTION);
        }
        return AccessDecision.deny(RULE_COLLECTION, DenyReason.INSUFFICIENT_ROLE);
    }

    private AccessDecision decidePrivate(boolean isAdmin, MethodClass methodClass) {
        if (methodClass == MethodClass.SAFE && isAdmin) {
            return AccessDecision.allowAdminPrivateView(RULE_ADMIN_PRIVATE_VIEW);
        }
        return AccessDecision.deny(RULE_PRIVATE, DenyReason.PRIVATE_RESOURCE);
    }

    private AccessDecision decideWithShare(SharePermission permission, MethodClass methodClass) {
        if (methodClass == MethodClass.SAFE || permission.canEdit()) {
            return AccessDecision.allow(RULE_SHARE);
        }
        return AccessDecision.deny(RULE_SHARE, DenyReason.INSUFFICIENT_SHARE);
    }

    private AccessDecision decideWithoutShare(boolean isAdmin, MethodClass methodClass) {
        if (methodClass == MethodClass.SAFE && isAdmin) {
            return AccessDecision.allow(RULE_ADMIN_SHARED_VIEW);
        }
        return AccessDecision.deny(RULE_SHARE, DenyReason.NO_SHARE);
    }
}
