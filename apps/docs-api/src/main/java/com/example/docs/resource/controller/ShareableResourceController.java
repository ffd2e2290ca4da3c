package com.example.docs.resource.controller;

import com.example.docs.access.model.AccessLevel;
import com.example.docs.comment.model.request.CreateCommentRequest;
import com.example.docs.comment.model.request.UpdateCommentRequest;
import com.example.docs.comment.model.response.CommentResponse;
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
import com.example.docs.resource.service.ShareableResourceService;
import com.example.docs.security.annotation.ResolvedAuth;
import com.example.docs.security.context.AuthContext;
import com.example.docs.version.model.response.VersionDetailResponse;
import com.example.docs.version.model.response.VersionPageResponse;
import com.example.docs.version.service.ResourceVersionService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Endpoints shared by documents and wiki pages. Subclasses only add the base path.
 */
@Slf4j
public abstract class ShareableResourceController<R extends ShareableResourceDoc, S extends ResourceShareDoc> {

    private final ShareableResourceService<R, S> service;

    protected ShareableResourceController(ShareableResourceService<R, S> service) {
        this.service = service;
    }

    @GetMapping
    public Flux<ResourceResponse> list(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @RequestParam(required = false) String collection,
            @RequestParam(required = false) String parent,
            @RequestParam(required = false) Integer access,
            @RequestParam(required = false) Boolean archived,
            @RequestParam(defaultValue = "false") boolean ownedByMe,
            ServerHttpRequest request) {

        ResourceListFilter filter = new ResourceListFilter(
                collection, parent, accessLevel(access), archived, ownedByMe);
        return service.list(auth, slug, filter, request);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ResourceResponse> create(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @Valid @RequestBody CreateResourceRequest body,
            ServerHttpRequest request) {

        log.debug("POST {} - user: {}", request.getPath().value(), auth.userId());
        return service.create(auth, slug, body, request);
    }

    @GetMapping("/{id}")
    public Mono<ResourceResponse> retrieve(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            ServerHttpRequest request) {

        return service.retrieve(auth, slug, id, request);
    }

    @PatchMapping("/{id}")
    public Mono<ResourceResponse> update(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            @Valid @RequestBody UpdateResourceRequest body,
            ServerHttpRequest request) {

        return service.update(auth, slug, id, body, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> delete(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            ServerHttpRequest request) {

        return service.delete(auth, slug, id, request);
    }

    @PostMapping("/{id}/lock")
    public Mono<ResourceResponse> lock(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            ServerHttpRequest request) {

        return service.lock(auth, slug, id, request);
    }

    @DeleteMapping("/{id}/lock")
    public Mono<ResourceResponse> unlock(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            ServerHttpRequest request) {

        return service.unlock(auth, slug, id, request);
    }

    @PostMapping("/{id}/archive")
    public Mono<ResourceResponse> archive(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            ServerHttpRequest request) {

        return service.archive(auth, slug, id, request);
    }

    @DeleteMapping("/{id}/archive")
    public Mono<ResourceResponse> unarchive(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            ServerHttpRequest request) {

        return service.unarchive(auth, slug, id, request);
    }

    @PostMapping("/{id}/duplicate")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ResourceResponse> duplicate(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            ServerHttpRequest request) {

        return service.duplicate(auth, slug, id, request);
    }

    @GetMapping("/{id}/access-logs")
    public Flux<AccessLogResponse> accessLogs(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            ServerHttpRequest request) {

        return service.accessLogs(auth, slug, id, request);
    }

    @GetMapping("/{id}/shares")
    public Flux<ShareResponse> listShares(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            ServerHttpRequest request) {

        return service.listShares(auth, slug, id, request);
    }

    @PostMapping("/{id}/shares")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ShareResponse> share(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            @Valid @RequestBody ShareRequest body,
            ServerHttpRequest request) {

        log.debug("POST {} - user: {}, permission: {}", request.getPath().value(), auth.userId(), body.permission());
        return service.share(auth, slug, id, body, request);
    }

    @PatchMapping("/{id}/shares/{userId}")
    public Mono<ShareResponse> updateShare(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            @PathVariable String userId,
            @Valid @RequestBody UpdateShareRequest body,
            ServerHttpRequest request) {

        return service.updateShare(auth, slug, id, userId, body, request);
    }

    @DeleteMapping("/{id}/shares/{userId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> unshare(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            @PathVariable String userId,
            ServerHttpRequest request) {

        return service.unshare(auth, slug, id, userId, request);
    }

    @GetMapping("/{id}/versions")
    public Mono<VersionPageResponse> listVersions(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "" + ResourceVersionService.DEFAULT_LIMIT) int limit,
            ServerHttpRequest request) {

        return service.listVersions(auth, slug, id, offset, limit, request);
    }

    @GetMapping("/{id}/versions/{versionId}")
    public Mono<VersionDetailResponse> retrieveVersion(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            @PathVariable String versionId,
            ServerHttpRequest request) {

        return service.retrieveVersion(auth, slug, id, versionId, request);
    }

    @PostMapping("/{id}/versions/{versionId}/restore")
    public Mono<ResourceResponse> restoreVersion(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            @PathVariable String versionId,
            ServerHttpRequest request) {

        log.debug("POST {} - user: {}", request.getPath().value(), auth.userId());
        return service.restoreVersion(auth, slug, id, versionId, request);
    }

    @GetMapping("/{id}/comments")
    public Flux<CommentResponse> listComments(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            ServerHttpRequest request) {

        return service.listComments(auth, slug, id, request);
    }

    @PostMapping("/{id}/comments")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<CommentResponse> createComment(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            @Valid @RequestBody CreateCommentRequest body,
            ServerHttpRequest request) {

        return service.createComment(auth, slug, id, body, request);
    }

    @GetMapping("/{id}/comments/{commentId}")
    public Mono<CommentResponse> retrieveComment(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            @PathVariable String commentId,
            ServerHttpRequest request) {

        return service.retrieveComment(auth, slug, id, commentId, request);
    }

    @PatchMapping("/{id}/comments/{commentId}")
    public Mono<CommentResponse> updateComment(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            @PathVariable String commentId,
            @Valid @RequestBody UpdateCommentRequest body,
            ServerHttpRequest request) {

        return service.updateComment(auth, slug, id, commentId, body, request);
    }

    @DeleteMapping("/{id}/comments/{commentId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteComment(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            @PathVariable String commentId,
            ServerHttpRequest request) {

        return service.deleteComment(auth, slug, id, commentId, request);
    }

    // Access levels travel as their numeric codes
    private static AccessLevel accessLevel(Integer code) {
        if (code == null) {
            return null;
        }
        try {
            return AccessLevel.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown access level: " + code);
        }
    }
}
