package com.example.docs.collection.service;

import com.example.docs.access.model.MethodClass;
import com.example.docs.access.model.ResourceKind;
import com.example.docs.access.service.ResourceAuthorizationService;
import com.example.docs.collection.document.CollectionDoc;
import com.example.docs.collection.model.request.CreateCollectionRequest;
import com.example.docs.collection.model.request.UpdateCollectionRequest;
import com.example.docs.collection.model.response.CollectionResponse;
import com.example.docs.collection.repository.CollectionRepository;
import com.example.docs.common.util.StringSanitizer;
import com.example.docs.exception.ResourceNotFoundException;
import com.example.docs.resource.document.ShareableResourceDoc;
import com.example.docs.resource.store.ResourceStore;
import com.example.docs.security.context.AuthContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collections of documents and wiki pages. Reads need workspace membership, writes need
 * MEMBER or ADMIN.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollectionService {

    public static final String ROOT = "root";

    private final CollectionRepository collectionRepository;
    private final ResourceAuthorizationService authorizationService;
    private final List<ResourceStore<?, ?>> stores;

    /**
     * Collections of {@code kind}. A {@code parent} of {@code root} keeps top-level collections,
     * any other non-blank value keeps that collection's direct children.
     */
    public Flux<CollectionResponse> list(
            AuthContext auth, String slug, ResourceKind kind, String parent, ServerHttpRequest request) {

        return authorizationService.requireCollectionAccess(auth, slug, MethodClass.SAFE, request)
                .flatMapMany(membership -> collectionRepository
                        .findByWorkspaceIdAndKindAndDeletedAtIsNullOrderBySortOrderAscCreatedAtAsc(
                                membership.workspaceId(), kind))
                .filter(collection -> matchesParent(collection, parent))
                .map(CollectionResponse::from);
    }

    public Mono<CollectionResponse> retrieve(
            AuthContext auth, String slug, ResourceKind kind, String id, ServerHttpRequest request) {

        return authorizationService.requireCollectionAccess(auth, slug, MethodClass.SAFE, request)
                .flatMap(membership -> load(membership.workspaceId(), kind, id))
                .map(CollectionResponse::from);
    }

    public Mono<CollectionResponse> create(
            AuthContext auth, String slug, ResourceKind kind,
            CreateCollectionRequest body, ServerHttpRequest request) {

        return authorizationService.requireCollectionAccess(auth, slug, MethodClass.MUTATING, request)
                .flatMap(membership -> {
                    String workspaceId = membership.workspaceId();
                    Mono<Void> parentCheck = isBlank(body.parentId())
                            ? Mono.empty()
                            : requireParent(workspaceId, kind, body.parentId());

                    CollectionDoc collection = CollectionDoc.builder()
                            .workspaceId(workspaceId)
                            .kind(kind)
                            .name(body.name().trim())
                            .description(body.description())
                            .parentId(isBlank(body.parentId()) ? null : body.parentId())
                            .sortOrder(body.sortOrder() != null
                                    ? body.sortOrder()
                                    : ShareableResourceDoc.DEFAULT_SORT_ORDER)
                            .createdBy(auth.userId())
                            .build();

                    return parentCheck.then(Mono.defer(() -> collectionRepository.save(collection)));
                })
                .doOnNext(saved -> log.info("Created {} collection {} in workspace {}",
                        kind, saved.getId(), StringSanitizer.forLog(slug)))
                .map(CollectionResponse::from);
    }

    public Mono<CollectionResponse> update(
            AuthContext auth, String slug, ResourceKind kind, String id,
            UpdateCollectionRequest body, ServerHttpRequest request) {

        return authorizationService.requireCollectionAccess(auth, slug, MethodClass.MUTATING, request)
                .flatMap(membership -> load(membership.workspaceId(), kind, id))
                .flatMap(collection -> applyParentChange(collection, body.parentId())
                        .then(Mono.fromCallable(() -> {
                            if (body.name() != null) {
                                collection.setName(body.name().trim());
                            }
                            if (body.description() != null) {
                                collection.setDescription(body.description());
                            }
                            if (body.sortOrder() != null) {
                                collection.setSortOrder(body.sortOrder());
                            }
                            return collection;
                        })))
                .flatMap(collectionRepository::save)
                .map(CollectionResponse::from);
    }

    /**
     * Soft delete. Child collections move up to the deleted collection's parent and the
     * resources it held lose their collection.
     */
    public Mono<Void> delete(
            AuthContext auth, String slug, ResourceKind kind, String id, ServerHttpRequest request) {

        return authorizationService.requireCollectionAccess(auth, slug, MethodClass.MUTATING, request)
                .flatMap(membership -> load(membership.workspaceId(), kind, id))
                .flatMap(collection -> collectionRepository.findByParentIdAndDeletedAtIsNull(collection.getId())
                        .flatMap(child -> {
                            child.setParentId(collection.getParentId());
                            return collectionRepository.save(child);
                        })
                        .then(detachResources(collection))
                        .then(Mono.defer(() -> {
                            collection.setDeletedAt(Instant.now());
                            return collectionRepository.save(collection);
                        })))
                .doOnNext(deleted -> log.info("Deleted {} collection {}", kind, deleted.getId()))
                .then();
    }

    /**
     * Whether a live collection of {@code kind} with this id exists in the workspace.
     */
    public Mono<Boolean> exists(String workspaceId, ResourceKind kind, String id) {
        return collectionRepository.findByIdAndWorkspaceIdAndKindAndDeletedAtIsNull(id, workspaceId, kind)
                .hasElement();
    }

    private Mono<Void> detachResources(CollectionDoc collection) {
        return Flux.fromIterable(stores)
                .filter(store -> store.kind() == collection.getKind())
                .flatMap(store -> detachFrom(store, collection.getWorkspaceId(), collection.getId()))
                .then();
    }

    private static <R extends ShareableResourceDoc> Mono<Void> detachFrom(
            ResourceStore<R, ?> store, String workspaceId, String collectionId) {
        return store.findInCollection(workspaceId, collectionId)
                .flatMap(resource -> {
                    resource.setCollectionId(null);
                    return store.save(resource);
                })
                .then();
    }

    private static boolean matchesParent(CollectionDoc collection, String parent) {
        if (isBlank(parent)) {
            return true;
        }
        if (ROOT.equals(parent)) {
            return collection.getParentId() == null;
        }
        return parent.equals(collection.getParentId());
    }

    private Mono<CollectionDoc> load(String workspaceId, ResourceKind kind, String id) {
        return collectionRepository.findByIdAndWorkspaceIdAndKindAndDeletedAtIsNull(id, workspaceId, kind)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Collection", id)));
    }

    private Mono<Void> applyParentChange(CollectionDoc collection, String newParentId) {
        if (newParentId == null) {
            return Mono.empty();
        }
        if (newParentId.isBlank()) {
            collection.setParentId(null);
            return Mono.empty();
        }
        if (newParentId.equals(collection.getId())) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "A collection cannot be its own parent"));
        }
        return requireParent(collection.getWorkspaceId(), collection.getKind(), newParentId)
                .then(createsCycle(collection, newParentId))
                .flatMap(cycle -> {
                    if (cycle) {
                        return Mono.<Void>error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                                "Moving the collection there would create a cycle"));
                    }
                    collection.setParentId(newParentId);
                    return Mono.<Void>empty();
                });
    }

    private Mono<Void> requireParent(String workspaceId, ResourceKind kind, String parentId) {
        return exists(workspaceId, kind, parentId)
                .flatMap(found -> found
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                                "Parent collection not found")));
    }

    // Walks up from the new parent; reaching the collection itself means a loop
    private Mono<Boolean> createsCycle(CollectionDoc collection, String newParentId) {
        Set<String> visited = new HashSet<>();
        return Mono.just(newParentId)
                .expand(parentId -> visited.add(parentId)
                        ? collectionRepository.findByIdAndWorkspaceIdAndKindAndDeletedAtIsNull(
                                        parentId, collection.getWorkspaceId(), collection.getKind())
                                .mapNotNull(CollectionDoc::getParentId)
                        : Mono.empty())
                .any(collection.getId()::equals);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
