package com.example.docs.collection.repository;

import com.example.docs.access.model.ResourceKind;
import com.example.docs.collection.document.CollectionDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface CollectionRepository extends ReactiveMongoRepository<CollectionDoc, String> {

    Mono<CollectionDoc> findByIdAndWorkspaceIdAndKindAndDeletedAtIsNull(String id, String workspaceId, ResourceKind kind);

    Flux<CollectionDoc> findByWorkspaceIdAndKindAndDeletedAtIsNullOrderBySortOrderAscCreatedAtAsc(
            String workspaceId, ResourceKind kind);

    Flux<CollectionDoc> findByParentIdAndDeletedAtIsNull(String parentId);
}
