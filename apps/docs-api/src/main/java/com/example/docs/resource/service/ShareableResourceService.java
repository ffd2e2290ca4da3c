package com.example.docs.resource.service;

import com.example.docs.access.audit.AccessAuditService;
import com.example.docs.access.model.AccessDecision;
import com.example.docs.access.model.AccessLevel;
import com.example.docs.access.model.AccessType;
import com.example.docs.access.model.MethodClass;
import com.example.docs.access.model.SharePermission;
import com.example.docs.access.service.ResourceAuthorizationService;
import com.example.docs.collection.service.CollectionService;
import com.example.docs.comment.document.ResourceCommentDoc;
import com.example.docs.comment.model.request.CreateCommentRequest;
import com.example.docs.comment.model.request.UpdateCommentRequest;
import com.example.docs.comment.model.response.CommentResponse;
import com.example.docs.comment.service.ResourceCommentService;
import com.example.docs.common.util.StringSanitizer;
import com.example.docs.exception.ResourceNotFoundException;
import com.example.docs.resource.document.ResourceShareDoc;
import com.example.docs.resource.document.ShareableResourceDoc;
import com.example.docs.resource.model.request.CreateResourceRequest;
import com.example.docs.resource.model.request.ResourceListFilter;
import com.example.docs.resource.model.request.ShareRequest;
import com.example.docs.resource.model.request.UpdateResourceRequest;
import com.example.docs.resource.model.request.UpdateShareRequest;
import com.example.docs.resource.model.response.AccessLogResponse;
import com.example.docs.resource.model.response.ResourceResponse;
import com.example.docs.resource.model.response.ShareResponse;
import com.example.docs.resource.store.ResourceStore;
import com.example.docs.security.context.AuthContext;
import com.example.docs.security.exception.AuthorizationException;
import com.example.docs.version.model.response.VersionDetailResponse;
import com.example.docs.version.model.response.VersionPageResponse;
import com.example.docs.version.service.ResourceVersionService;
import com.example.docs.workspace.model.WorkspaceMembership;
import com.example.docs.workspace.service.WorkspaceMembershipService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operations on documents and wiki pages. One subclass per resource kind supplies the store;
 * everything else, including every access check, is shared.
 *
 * <p>Each operation resolves the caller's membership, loads the resource from the caller's
 * workspace (404 otherwise) and asks {@link ResourceAuthorizationService} for a decision before
 * touching anything.
 */
@Slf4j
public abstract class ShareableResourceService<R extends ShareableResourceDoc, S extends ResourceShareDoc> {

    static final String COPY_SUFFIX = " (Copy)";

    private final ResourceStore<R, S> store;
    private final ResourceAuthorizationService authorizationService;
    private final AccessAuditService auditService;
    private final WorkspaceMembershipService membershipService;
    private final CollectionService collectionService;
    private final ResourceVersionService versionService;
    private final ResourceCommentService commentService;

    protected ShareableResourceService(
            ResourceStore<R, S> store,
            ResourceAuthorizationService authorizationService,
            AccessAuditService auditService,
            WorkspaceMembershipService membershipService,
            CollectionService collectionService,
            ResourceVersionService versionService,
            ResourceCommentService commentService) {
        this.store = store;
        this.authorizationService = authorizationService;
        this.auditService = auditService;
        this.membershipService = membershipService;
        this.collectionService = collectionService;
        this.versionService = versionService;
        this.commentService = commentService;
    }

    private record Authorized<T>(WorkspaceMembership membership, T resource, AccessDecision decision) {
    }

    // ---- Resources ----

    /**
     * Admins see every live resource in the workspace; everyone else sees what they own
     * plus what is shared with them.
     */
    public Flux<ResourceResponse> list(
            AuthContext auth, String slug, ResourceListFilter filter, ServerHttpRequest request) {

        ResourceListFilter effective = filter != null ? filter : ResourceListFilter.none();
        return authorizationService.requireMembership(auth, slug, MethodClass.SAFE, request)
                .flatMapMany(membership -> visibleResources(membership, auth.userId()))
                .filter(resource -> matches(resource, effective, auth.userId()))
                .map(resource -> ResourceResponse.from(resource, auth.userId()));
    }

    /**
     * New resources are always PRIVATE and owned by the caller. Only workspace membership is required.
     */
    public Mono<ResourceResponse> create(
            AuthContext auth, String slug, CreateResourceRequest body, ServerHttpRequest request) {

        return authorizationService.requireMembership(auth, slug, MethodClass.MUTATING, request)
                .flatMap(membership -> {
                    String workspaceId = membership.workspaceId();
                    String collectionId = blankToNull(body.collectionId());
                    String parentId = blankToNull(body.parentId());

                    R resource = store.newResource();
                    resource.setWorkspaceId(workspaceId);
                    resource.setName(body.name().trim());
                    resource.setDescriptionHtml(body.descriptionHtml());
                    resource.setCollectionId(collectionId);
                    resource.setParentId(parentId);
                    resource.setAccess(AccessLevel.PRIVATE);
                    resource.setOwnedBy(auth.userId());
                    resource.setSortOrder(body.sortOrder() != null
                            ? body.sortOrder()
                            : ShareableResourceDoc.DEFAULT_SORT_ORDER);

                    return requireCollection(workspaceId, collectionId)
                            .then(requireParent(workspaceId, parentId))
                            .then(Mono.defer(() -> store.save(resource)));
                })
                .doOnNext(saved -> log.info("Created {} {} in workspace {}",
                        store.kind(), saved.getId(), StringSanitizer.forLog(slug)))
                .map(saved -> ResourceResponse.from(saved, auth.userId()));
    }

    /**
     * Reads one resource and records the view. An admin reading someone else's private resource
     * is recorded as ADMIN_VIEW, and the read fails if that record cannot be written.
     */
    public Mono<ResourceResponse> retrieve(
            AuthContext auth, String slug, String id, ServerHttpRequest request) {

        return authorize(auth, slug, id, MethodClass.SAFE, request)
                .flatMap(authorized -> {
                    R resource = authorized.resource();
                    if (authorized.decision().adminPrivateView()) {
                        log.info("Admin {} viewing private {} {} owned by {}",
                                StringSanitizer.forLog(auth.userId()), store.kind(),
                                resource.getId(), StringSanitizer.forLog(resource.getOwnedBy()));
                        return auditService.record(AccessType.ADMIN_VIEW, resource, auth, request,
                                        Map.of("ownerId", resource.getOwnedBy()))
                                .thenReturn(resource);
                    }
                    return auditService.record(AccessType.VIEW, resource, auth, request, null)
                            .thenReturn(resource)
                            .onErrorResume(e -> {
                                log.warn("Failed to record view of {} {}: {}",
                                        store.kind(), resource.getId(), e.getMessage());
                                return Mono.just(resource);
                            });
                })
                .map(resource -> ResourceResponse.from(resource, auth.userId()));
    }

    /**
     * Partial update. A content change also records a version of the saved content.
     */
    public Mono<ResourceResponse> update(
            AuthContext auth, String slug, String id, UpdateResourceRequest body, ServerHttpRequest request) {

        return authorize(auth, slug, id, MethodClass.MUTATING, request)
                .flatMap(authorized -> {
                    R resource = authorized.resource();
                    List<String> changed = new ArrayList<>();

                    if (body.access() != null && body.access() != resource.getAccess()) {
                        if (body.access() == AccessLevel.PUBLIC) {
                            return Mono.error(badRequest("Public access is disabled"));
                        }
                        if (!resource.isOwnedBy(auth.userId())) {
                            return Mono.error(badRequest("Only the owner can change access"));
                        }
                    }

                    return applyCollectionChange(resource, body.collectionId(), changed)
                            .then(applyParentChange(resource, body.parentId(), changed))
                            .then(Mono.defer(() -> {
                                if (body.name() != null && !body.name().trim().equals(resource.getName())) {
                                    resource.setName(body.name().trim());
                                    changed.add("name");
                                }
                                if (body.descriptionHtml() != null
                                        && !body.descriptionHtml().equals(resource.getDescriptionHtml())) {
                                    resource.setDescriptionHtml(body.descriptionHtml());
                                    changed.add("descriptionHtml");
                                }
                                if (body.access() != null && body.access() != resource.getAccess()) {
                                    resource.setAccess(body.access());
                                    changed.add("access");
                                }
                                if (body.sortOrder() != null && !body.sortOrder().equals(resource.getSortOrder())) {
                                    resource.setSortOrder(body.sortOrder());
                                    changed.add("sortOrder");
                                }
                                return store.save(resource);
                            }))
                            .flatMap(saved -> changed.contains("descriptionHtml")
                                    ? versionService.snapshot(saved, auth.userId()).thenReturn(saved)
                                    : Mono.just(saved))
                            .flatMap(saved -> changed.isEmpty()
                                    ? Mono.just(saved)
                                    : auditService.record(AccessType.EDIT, saved, auth, request,
                                            Map.of("fields", List.copyOf(changed))).thenReturn(saved));
                })
                .map(saved -> ResourceResponse.from(saved, auth.userId()));
    }

    /**
     * Soft delete. The resource must be archived first, and only its owner or a workspace admin
     * may delete it. Children move to the top level.
     */
    public Mono<Void> delete(AuthContext auth, String slug, String id, ServerHttpRequest request) {
        return authorize(auth, slug, id, MethodClass.MUTATING, request)
                .flatMap(authorized -> {
                    R resource = authorized.resource();
                    if (!resource.isArchived()) {
                        return Mono.error(badRequest("The resource must be archived before it can be deleted"));
                    }
                    if (!isOwnerOrAdmin(resource, authorized.membership())) {
                        return Mono.error(new AuthorizationException(
                                "Only the owner or a workspace admin can delete"));
                    }
                    return store.findChildren(resource.getId())
                            .flatMap(child -> {
                                child.setParentId(null);
                                return store.save(child);
                            })
                            .then(Mono.defer(() -> {
                                resource.setDeletedAt(Instant.now());
                                return store.save(resource);
                            }));
                })
                .doOnNext(deleted -> log.info("Deleted {} {}", store.kind(), deleted.getId()))
                .then();
    }

    public Mono<ResourceResponse> lock(AuthContext auth, String slug, String id, ServerHttpRequest request) {
        return setLocked(auth, slug, id, true, request);
    }

    public Mono<ResourceResponse> unlock(AuthContext auth, String slug, String id, ServerHttpRequest request) {
        return setLocked(auth, slug, id, false, request);
    }

    /**
     * Archives the resource and all of its descendants.
     */
    public Mono<ResourceResponse> archive(AuthContext auth, String slug, String id, ServerHttpRequest request) {
        return authorize(auth, slug, id, MethodClass.MUTATING, request)
                .flatMap(authorized -> {
                    R resource = authorized.resource();
                    if (!isOwnerOrAdmin(resource, authorized.membership())) {
                        return Mono.error(badRequest("Only the owner or a workspace admin can archive"));
                    }
                    Instant now = Instant.now();
                    return withDescendants(resource)
                            .concatMap(node -> {
                                node.setArchivedAt(now);
                                return store.save(node);
                            })
                            .then(Mono.defer(() -> auditService.record(AccessType.ARCHIVE, resource, auth, request, null)))
                            .thenReturn(resource);
                })
                .map(resource -> ResourceResponse.from(resource, auth.userId()));
    }

    /**
     * Restores the resource and all of its descendants. A resource whose parent is still archived
     * moves to the top level.
     */
    public Mono<ResourceResponse> unarchive(AuthContext auth, String slug, String id, ServerHttpRequest request) {
        return authorize(auth, slug, id, MethodClass.MUTATING, request)
                .flatMap(authorized -> {
                    R resource = authorized.resource();
                    if (!isOwnerOrAdmin(resource, authorized.membership())) {
                        return Mono.error(badRequest("Only the owner or a workspace admin can restore"));
                    }
                    return detachFromArchivedParent(resource)
                            .thenMany(withDescendants(resource))
                            .concatMap(node -> {
                                node.setArchivedAt(null);
                                return store.save(node);
                            })
                            .then(Mono.defer(() -> auditService.record(AccessType.RESTORE, resource, auth, request, null)))
                            .thenReturn(resource);
                })
                .map(resource -> ResourceResponse.from(resource, auth.userId()));
    }

    /**
     * Private copy owned by the caller.
     */
    public Mono<ResourceResponse> duplicate(AuthContext auth, String slug, String id, ServerHttpRequest request) {
        return authorize(auth, slug, id, MethodClass.MUTATING, request)
                .flatMap(authorized -> {
                    R source = authorized.resource();
                    R copy = store.newResource();
                    copy.setWorkspaceId(source.getWorkspaceId());
                    copy.setName(source.getName() + COPY_SUFFIX);
                    copy.setDescriptionHtml(source.getDescriptionHtml());
                    copy.setCollectionId(source.getCollectionId());
                    copy.setParentId(source.getParentId());
                    copy.setSortOrder(source.getSortOrder());
                    copy.setAccess(AccessLevel.PRIVATE);
                    copy.setOwnedBy(auth.userId());

                    return store.save(copy)
                            .flatMap(saved -> auditService.record(AccessType.EDIT, saved, auth, request,
                                            Map.of("action", "duplicate", "sourceId", source.getId()))
                                    .thenReturn(saved));
                })
                .map(saved -> ResourceResponse.from(saved, auth.userId()));
    }

    /**
     * Access log of a resource, newest first. Owner or workspace admin only.
     */
    public Flux<AccessLogResponse> accessLogs(AuthContext auth, String slug, String id, ServerHttpRequest request) {
        return authorize(auth, slug, id, MethodClass.SAFE, request)
                .flatMapMany(authorized -> {
                    if (!isOwnerOrAdmin(authorized.resource(), authorized.membership())) {
                        return Flux.error(new AuthorizationException(
                                "Only the owner or a workspace admin can read access logs"));
                    }
                    return auditService.history(authorized.resource());
                })
                .map(AccessLogResponse::from);
    }

    // ---- Shares ----

    public Flux<ShareResponse> listShares(AuthContext auth, String slug, String id, ServerHttpRequest request) {
        return authorize(auth, slug, id, MethodClass.SAFE, request)
                .flatMapMany(authorized -> store.findActiveShares(authorized.resource().getId()))
                .map(ShareResponse::from);
    }

    /**
     * Creates or updates the caller-granted share for {@code body.userId()}. A PRIVATE resource
     * becomes SHARED.
     */
    public Mono<ShareResponse> share(
            AuthContext auth, String slug, String id, ShareRequest body, ServerHttpRequest request) {

        return authorizeShareManagement(auth, slug, id, request)
                .flatMap(authorized -> {
                    R resource = authorized.resource();
                    String targetUserId = body.userId().trim();
                    if (targetUserId.equals(auth.userId())) {
                        return Mono.error(badRequest("You cannot share a resource with yourself"));
                    }
                    return membershipService.isActiveMember(resource.getWorkspaceId(), targetUserId)
                            .flatMap(isMember -> {
                                if (!isMember) {
                                    return Mono.error(badRequest("User is not an active member of this workspace"));
                                }
                                return upsertShare(resource, targetUserId, body.permission(), auth.userId());
                            })
                            .flatMap(share -> promoteToShared(resource).thenReturn(share))
                            .flatMap(share -> auditService.record(AccessType.SHARE, resource, auth, request,
                                            Map.of("sharedWith", targetUserId,
                                                    "permission", share.getPermission().name()))
                                    .thenReturn(share));
                })
                .map(ShareResponse::from);
    }

    public Mono<ShareResponse> updateShare(
            AuthContext auth, String slug, String id, String targetUserId,
            UpdateShareRequest body, ServerHttpRequest request) {

        return authorizeShareManagement(auth, slug, id, request)
                .flatMap(authorized -> store.findActiveShare(authorized.resource().getId(), targetUserId)
                        .switchIfEmpty(Mono.error(new ResourceNotFoundException("Share", targetUserId)))
                        .flatMap(share -> {
                            share.setPermission(body.permission());
                            return store.saveShare(share);
                        })
                        .flatMap(share -> auditService.record(AccessType.SHARE, authorized.resource(), auth,
                                        request, Map.of("sharedWith", targetUserId,
                                                "permission", share.getPermission().name(),
                                                "action", "update"))
                                .thenReturn(share)))
                .map(ShareResponse::from);
    }

    /**
     * Revokes a share. A SHARED resource with no remaining active shares goes back to PRIVATE.
     */
    public Mono<Void> unshare(
            AuthContext auth, String slug, String id, String targetUserId, ServerHttpRequest request) {

        return authorizeShareManagement(auth, slug, id, request)
                .flatMap(authorized -> {
                    R resource = authorized.resource();
                    Instant revokedAt = Instant.now();
                    return store.findActiveShares(resource.getId(), targetUserId)
                            .switchIfEmpty(Mono.error(new ResourceNotFoundException("Share", targetUserId)))
                            .concatMap(share -> {
                                share.setDeletedAt(revokedAt);
                                return store.saveShare(share);
                            })
                            .then(Mono.defer(() -> demoteIfUnshared(resource)))
                            .then(Mono.defer(() -> auditService.record(AccessType.UNSHARE, resource, auth,
                                    request, Map.of("unsharedWith", targetUserId))));
                })
                .then();
    }

    // ---- Versions ----

    public Mono<VersionPageResponse> listVersions(
            AuthContext auth, String slug, String id, int offset, int limit, ServerHttpRequest request) {

        return authorize(auth, slug, id, MethodClass.SAFE, request)
                .flatMap(authorized -> recordAdminView(authorized, auth, request, "list_versions"))
                .flatMap(authorized -> versionService.page(authorized.resource(), offset, limit));
    }

    public Mono<VersionDetailResponse> retrieveVersion(
            AuthContext auth, String slug, String id, String versionId, ServerHttpRequest request) {

        return authorize(auth, slug, id, MethodClass.SAFE, request)
                .flatMap(authorized -> recordAdminView(authorized, auth, request, "retrieve_version"))
                .flatMap(authorized -> versionService.find(authorized.resource(), versionId))
                .map(VersionDetailResponse::from);
    }

    /**
     * Puts an earlier version's content back. The current content is saved as a version first.
     */
    public Mono<ResourceResponse> restoreVersion(
            AuthContext auth, String slug, String id, String versionId, ServerHttpRequest request) {

        return authorize(auth, slug, id, MethodClass.MUTATING, request)
                .flatMap(authorized -> {
                    R resource = authorized.resource();
                    return versionService.find(resource, versionId)
                            .flatMap(version -> versionService.snapshot(resource, auth.userId())
                                    .then(Mono.defer(() -> {
                                        resource.setDescriptionHtml(version.getDescriptionHtml());
                                        return store.save(resource);
                                    })))
                            .flatMap(saved -> auditService.record(AccessType.EDIT, saved, auth, request,
                                            Map.of("action", "restore", "restoredVersionId", versionId))
                                    .thenReturn(saved));
                })
                .doOnNext(saved -> log.info("Restored {} {} to version {}",
                        store.kind(), saved.getId(), StringSanitizer.forLog(versionId)))
                .map(saved -> ResourceResponse.from(saved, auth.userId()));
    }

    // ---- Comments ----

    public Flux<CommentResponse> listComments(
            AuthContext auth, String slug, String id, ServerHttpRequest request) {

        return authorize(auth, slug, id, MethodClass.SAFE, request)
                .flatMap(authorized -> recordAdminView(authorized, auth, request, "list_comments"))
                .flatMapMany(authorized -> commentService.list(authorized.resource()))
                .map(CommentResponse::from);
    }

    public Mono<CommentResponse> retrieveComment(
            AuthContext auth, String slug, String id, String commentId, ServerHttpRequest request) {

        return authorize(auth, slug, id, MethodClass.SAFE, request)
                .flatMap(authorized -> recordAdminView(authorized, auth, request, "retrieve_comment"))
                .flatMap(authorized -> commentService.find(authorized.resource(), commentId))
                .map(CommentResponse::from);
    }

    public Mono<CommentResponse> createComment(
            AuthContext auth, String slug, String id, CreateCommentRequest body, ServerHttpRequest request) {

        return authorize(auth, slug, id, MethodClass.MUTATING, request)
                .flatMap(authorized -> commentService.create(
                        authorized.resource(), auth.userId(), body.commentHtml(), body.parentId()))
                .map(CommentResponse::from);
    }

    /**
     * Only the comment's author may edit it. Edits and deletes need read access to the resource,
     * the author rules narrow them further.
     */
    public Mono<CommentResponse> updateComment(
            AuthContext auth, String slug, String id, String commentId,
            UpdateCommentRequest body, ServerHttpRequest request) {

        return authorize(auth, slug, id, MethodClass.SAFE, request)
                .flatMap(authorized -> commentService.find(authorized.resource(), commentId))
                .flatMap(comment -> {
                    if (!comment.isAuthoredBy(auth.userId())) {
                        return Mono.<ResourceCommentDoc>error(
                                new AuthorizationException("Only the comment author can edit"));
                    }
                    return commentService.edit(comment, body.commentHtml());
                })
                .map(CommentResponse::from);
    }

    /**
     * The comment's author, the resource owner or a workspace admin may delete a comment.
     */
    public Mono<Void> deleteComment(
            AuthContext auth, String slug, String id, String commentId, ServerHttpRequest request) {

        return authorize(auth, slug, id, MethodClass.SAFE, request)
                .flatMap(authorized -> commentService.find(authorized.resource(), commentId)
                        .flatMap(comment -> {
                            if (!comment.isAuthoredBy(auth.userId())
                                    && !isOwnerOrAdmin(authorized.resource(), authorized.membership())) {
                                return Mono.<ResourceCommentDoc>error(new AuthorizationException(
                                        "Only the author, the owner or a workspace admin can delete a comment"));
                            }
                            return commentService.delete(comment);
                        }))
                .then();
    }

    // ---- Helpers ----

    private Mono<Authorized<R>> authorize(
            AuthContext auth, String slug, String id, MethodClass methodClass, ServerHttpRequest request) {

        return authorizationService.requireMembershipForResource(auth, slug, methodClass, request)
                .flatMap(membership -> store.findActiveInWorkspace(membership.workspaceId(), id)
                        .switchIfEmpty(Mono.error(new ResourceNotFoundException(store.kind().displayName(), id)))
                        .flatMap(resource -> authorizationService.require(
                                        auth, membership, resource, methodClass, store.shareLookup(), request)
                                .map(decision -> new Authorized<>(membership, resource, decision))));
    }

    // An admin reading content of someone else's private resource leaves an ADMIN_VIEW entry or fails
    private Mono<Authorized<R>> recordAdminView(
            Authorized<R> authorized, AuthContext auth, ServerHttpRequest request, String action) {

        if (!authorized.decision().adminPrivateView()) {
            return Mono.just(authorized);
        }
        R resource = authorized.resource();
        return auditService.record(AccessType.ADMIN_VIEW, resource, auth, request,
                        Map.of("ownerId", resource.getOwnedBy(), "action", action))
                .thenReturn(authorized);
    }

    // Owner, or holder of an ADMIN share
    private Mono<Authorized<R>> authorizeShareManagement(
            AuthContext auth, String slug, String id, ServerHttpRequest request) {

        return authorize(auth, slug, id, MethodClass.MUTATING, request)
                .flatMap(authorized -> {
                    if (authorized.resource().isOwnedBy(auth.userId())) {
                        return Mono.just(authorized);
                    }
                    return store.findActivePermission(authorized.resource().getId(), auth.userId())
                            .filter(SharePermission::canManageShares)
                            .map(permission -> authorized)
                            .switchIfEmpty(Mono.error(new AuthorizationException(
                                    "Only the owner or a share admin can manage shares")));
                });
    }

    private Mono<ResourceResponse> setLocked(
            AuthContext auth, String slug, String id, boolean locked, ServerHttpRequest request) {

        return authorize(auth, slug, id, MethodClass.MUTATING, request)
                .flatMap(authorized -> {
                    R resource = authorized.resource();
                    resource.setLocked(locked);
                    resource.setLockedBy(locked ? auth.userId() : null);
                    return store.save(resource)
                            .flatMap(saved -> auditService.record(
                                            locked ? AccessType.LOCK : AccessType.UNLOCK,
                                            saved, auth, request, null)
                                    .thenReturn(saved));
                })
                .map(saved -> ResourceResponse.from(saved, auth.userId()));
    }

    private Flux<R> visibleResources(WorkspaceMembership membership, String userId) {
        Flux<R> all = store.findActiveInWorkspace(membership.workspaceId());
        if (membership.isAdmin()) {
            return all;
        }
        return store.findSharedResourceIds(membership.workspaceId(), userId)
                .collect(HashSet<String>::new, Set::add)
                .flatMapMany(sharedIds -> all.filter(resource ->
                        resource.isOwnedBy(userId) || sharedIds.contains(resource.getId())));
    }

    private static boolean matches(ShareableResourceDoc resource, ResourceListFilter filter, String userId) {
        if (filter.collection() != null) {
            boolean match = ResourceListFilter.NO_COLLECTION.equals(filter.collection())
                    ? resource.getCollectionId() == null
                    : filter.collection().equals(resource.getCollectionId());
            if (!match) {
                return false;
            }
        }
        if (filter.parent() != null) {
            boolean match = ResourceListFilter.ROOT.equals(filter.parent())
                    ? resource.getParentId() == null
                    : filter.parent().equals(resource.getParentId());
            if (!match) {
                return false;
            }
        }
        if (filter.access() != null && filter.access() != resource.getAccess()) {
            return false;
        }
        if (filter.archived() != null && filter.archived() != resource.isArchived()) {
            return false;
        }
        return !filter.ownedByMe() || resource.isOwnedBy(userId);
    }

    private Mono<Void> applyCollectionChange(R resource, String collectionId, List<String> changed) {
        if (collectionId == null || Objects.equals(blankToNull(collectionId), resource.getCollectionId())) {
            return Mono.empty();
        }
        String newCollectionId = blankToNull(collectionId);
        return requireCollection(resource.getWorkspaceId(), newCollectionId)
                .then(Mono.fromRunnable(() -> {
                    resource.setCollectionId(newCollectionId);
                    changed.add("collectionId");
                }));
    }

    private Mono<Void> applyParentChange(R resource, String parentId, List<String> changed) {
        if (parentId == null || Objects.equals(blankToNull(parentId), resource.getParentId())) {
            return Mono.empty();
        }
        String newParentId = blankToNull(parentId);
        if (newParentId == null) {
            resource.setParentId(null);
            changed.add("parentId");
            return Mono.empty();
        }
        if (newParentId.equals(resource.getId())) {
            return Mono.error(badRequest("A resource cannot be its own parent"));
        }
        return requireParent(resource.getWorkspaceId(), newParentId)
                .then(isAncestorOrSelf(resource.getId(), resource.getWorkspaceId(), newParentId))
                .flatMap(cycle -> {
                    if (cycle) {
                        return Mono.<Void>error(badRequest("Moving the resource there would create a cycle"));
                    }
                    resource.setParentId(newParentId);
                    changed.add("parentId");
                    return Mono.<Void>empty();
                });
    }

    private Mono<Void> requireCollection(String workspaceId, String collectionId) {
        if (collectionId == null) {
            return Mono.empty();
        }
        return collectionService.exists(workspaceId, store.kind(), collectionId)
                .flatMap(found -> found
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(badRequest("Collection not found")));
    }

    private Mono<Void> requireParent(String workspaceId, String parentId) {
        if (parentId == null) {
            return Mono.empty();
        }
        return store.findActiveInWorkspace(workspaceId, parentId)
                .switchIfEmpty(Mono.error(badRequest("Parent not found")))
                .then();
    }

    // True when walking up from startId reaches resourceId
    private Mono<Boolean> isAncestorOrSelf(String resourceId, String workspaceId, String startId) {
        Set<String> visited = new HashSet<>();
        return Mono.just(startId)
                .expand(currentId -> visited.add(currentId)
                        ? store.findActiveInWorkspace(workspaceId, currentId).mapNotNull(R::getParentId)
                        : Mono.empty())
                .any(resourceId::equals);
    }

    private Flux<R> withDescendants(R root) {
        Set<String> visited = ConcurrentHashMap.newKeySet();
        visited.add(root.getId());
        return Mono.just(root)
                .expand(node -> store.findChildren(node.getId())
                        .filter(child -> visited.add(child.getId())));
    }

    private Mono<Void> detachFromArchivedParent(R resource) {
        if (resource.getParentId() == null) {
            return Mono.empty();
        }
        return store.findActiveInWorkspace(resource.getWorkspaceId(), resource.getParentId())
                .map(ShareableResourceDoc::isArchived)
                .defaultIfEmpty(true)
                .doOnNext(parentArchived -> {
                    if (parentArchived) {
                        resource.setParentId(null);
                    }
                })
                .then();
    }

    private Mono<S> upsertShare(R resource, String targetUserId, SharePermission permission, String grantedBy) {
        return updateActiveShare(resource, targetUserId, permission)
                .switchIfEmpty(Mono.defer(() -> {
                    S share = store.newShare();
                    share.setResourceId(resource.getId());
                    share.setUserId(targetUserId);
                    share.setWorkspaceId(resource.getWorkspaceId());
                    share.setPermission(permission);
                    share.setCreatedBy(grantedBy);
                    return store.saveShare(share);
                }))
                // Lost a concurrent insert for the same pair
                .onErrorResume(DuplicateKeyException.class, e -> {
                    log.debug("Concurrent share of {} with {}, updating the existing grant",
                            resource.getId(), StringSanitizer.forLog(targetUserId));
                    return updateActiveShare(resource, targetUserId, permission)
                            .switchIfEmpty(Mono.error(e));
                });
    }

    private Mono<S> updateActiveShare(R resource, String targetUserId, SharePermission permission) {
        return store.findActiveShare(resource.getId(), targetUserId)
                .flatMap(existing -> {
                    existing.setPermission(permission);
                    return store.saveShare(existing);
                });
    }

    private Mono<R> promoteToShared(R resource) {
        if (resource.getAccess() != AccessLevel.PRIVATE) {
            return Mono.just(resource);
        }
        resource.setAccess(AccessLevel.SHARED);
        return store.save(resource);
    }

    private Mono<R> demoteIfUnshared(R resource) {
        if (resource.getAccess() != AccessLevel.SHARED) {
            return Mono.just(resource);
        }
        return store.countActiveShares(resource.getId())
                .flatMap(remaining -> {
                    if (remaining > 0) {
                        return Mono.just(resource);
                    }
                    resource.setAccess(AccessLevel.PRIVATE);
                    return store.save(resource);
                });
    }

    private static boolean isOwnerOrAdmin(ShareableResourceDoc resource, WorkspaceMembership membership) {
        return resource.isOwnedBy(membership.userId()) || membership.isAdmin();
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
