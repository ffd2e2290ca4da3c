package com.example.docs.collection.controller;

import com.example.docs.access.model.ResourceKind;
import com.example.docs.collection.model.request.CreateCollectionRequest;
import com.example.docs.collection.model.request.UpdateCollectionRequest;
import com.example.docs.collection.model.response.CollectionResponse;
import com.example.docs.collection.service.CollectionService;
import com.example.docs.security.annotation.ResolvedAuth;
import com.example.docs.security.context.AuthContext;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Collection endpoints for one resource kind.
 */
public abstract class CollectionController {

    private final CollectionService collectionService;
    private final ResourceKind kind;

    protected CollectionController(CollectionService collectionService, ResourceKind kind) {
        this.collectionService = collectionService;
        this.kind = kind;
    }

    @GetMapping
    public Flux<CollectionResponse> list(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @RequestParam(required = false) String parent,
            ServerHttpRequest request) {

        return collectionService.list(auth, slug, kind, parent, request);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<CollectionResponse> create(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @Valid @RequestBody CreateCollectionRequest body,
            ServerHttpRequest request) {

        return collectionService.create(auth, slug, kind, body, request);
    }

    @GetMapping("/{id}")
    public Mono<CollectionResponse> retrieve(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            ServerHttpRequest request) {

        return collectionService.retrieve(auth, slug, kind, id, request);
    }

    @PatchMapping("/{id}")
    public Mono<CollectionResponse> update(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            @Valid @RequestBody UpdateCollectionRequest body,
            ServerHttpRequest request) {

        return collectionService.update(auth, slug, kind, id, body, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> delete(
            @ResolvedAuth AuthContext auth,
            @PathVariable String slug,
            @PathVariable String id,
            ServerHttpRequest request) {

        return collectionService.delete(auth, slug, kind, id, request);
    }
}
