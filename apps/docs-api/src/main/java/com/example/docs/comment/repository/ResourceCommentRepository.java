package com.example.docs.comment.repository;

import com.example.docs.access.model.ResourceKind;
import com.example.docs.comment.document.ResourceCommentDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ResourceCommentRepository extends ReactiveMongoRepository<ResourceCommentDoc, String> {

    Flux<ResourceCommentDoc> findByResourceKindAndResourceIdAndDeletedAtIsNullOrderByCreatedAtDesc(
            ResourceKind resourceKind, String resourceId);

    Mono<ResourceCommentDoc> findByIdAndResourceKindAndResourceIdAndDeletedAtIsNull(
            String id, ResourceKind resourceKind, String resourceId);
}
