package com.example.docs.resource.store;

import com.example.docs.access.engine.ShareLookup;
import com.example.docs.access.model.ResourceKind;
import com.example.docs.access.model.SharePermission;
import com.example.docs.resource.document.ResourceShareDoc;
import com.example.docs.resource.document.ShareableResourceDoc;
import com.example.docs.resource.repository.ResourceShareRepository;
import com.example.docs.resource.repository.ShareableResourceRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Resource and share persistence for one resource kind.
 *
 * @param <R> resource document type
 * @param <S> share document type
 */
public abstract class ResourceStore<R extends ShareableResourceDoc, S extends ResourceShareDoc> {

    private final ResourceKind kind;
    private final ShareableResourceRepository<R> resources;
    private final ResourceShareRepository<S> shares;

    protected ResourceStore(
            ResourceKind kind,
            ShareableResourceRepository<R> resources,
            ResourceShareRepository<S> shares) {
        this.kind = kind;
        this.resources = resources;
        this.shares = shares;
    }

    public ResourceKind kind() {
        return kind;
    }

    /**
     * Empty instance of this kind, for create and duplicate.
     */
    public abstract R newResource();

    public abstract S newShare();

    public Mono<R> findActiveInWorkspace(String workspaceId, String id) {
        return resources.findByIdAndWorkspaceIdAndDeletedAtIsNull(id, workspaceId);
    }

    public Flux<R> findActiveInWorkspace(String workspaceId) {
        return resources.findByWorkspaceIdAndDeletedAtIsNullOrderBySortOrderAscCreatedAtDesc(workspaceId);
    }

    public Flux<R> findChildren(String parentId) {
        return resources.findByParentIdAndDeletedAtIsNull(parentId);
    }

    public Flux<R> findInCollection(String workspaceId, String collectionId) {
        return resources.findByWorkspaceIdAndCollectionIdAndDeletedAtIsNull(workspaceId, collectionId);
    }

    public Mono<R> save(R resource) {
        return resources.save(resource);
    }

    public Mono<S> findActiveShare(String resourceId, String userId) {
        return shares.findFirstByResourceIdAndUserIdAndDeletedAtIsNull(resourceId, userId);
    }

    /**
     * Every live share for the pair. Records written before the unique index existed may hold more than one.
     */
    public Flux<S> findActiveShares(String resourceId, String userId) {
        return shares.findByResourceIdAndUserIdAndDeletedAtIsNull(resourceId, userId);
    }

    /**
     * Share lookup handed to the access evaluator.
     */
    public ShareLookup shareLookup() {
        return (resourceId, userId) -> findActiveShare(resourceId, userId)
                .mapNotNull(S::getPermission);
    }

    public Mono<SharePermission> findActivePermission(String resourceId, String userId) {
        return shareLookup().findActiveShare(resourceId, userId);
    }

    public Flux<S> findActiveShares(String resourceId) {
        return shares.findByResourceIdAndDeletedAtIsNullOrderByCreatedAtAsc(resourceId);
    }

    public Mono<Long> countActiveShares(String resourceId) {
        return shares.countByResourceIdAndDeletedAtIsNull(resourceId);
    }

    public Flux<String> findSharedResourceIds(String workspaceId, String userId) {
        return shares.findByWorkspaceIdAndUserIdAndDeletedAtIsNull(workspaceId, userId)
                .map(S::getResourceId);
    }

    public Mono<S> saveShare(S share) {
        return shares.save(share);
    }
}
