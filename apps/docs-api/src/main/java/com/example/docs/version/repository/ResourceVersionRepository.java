package com.example.docs.version.repository;

import com.example.docs.access.model.ResourceKind;
import com.example.docs.version.document.ResourceVersionDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ResourceVersionRepository extends ReactiveMongoRepository<ResourceVersionDoc, String> {

    Flux<ResourceVersionDoc> findByResourceKindAndResourceIdOrderByCreatedAtDesc(
            ResourceKind resourceKind, String resourceId);

    Mono<Long> countByResourceKindAndResourceId(ResourceKind resourceKind, String resourceId);

    Mono<ResourceVersionDoc> findByIdAndResourceKindAndResourceId(
            String id, ResourceKind resourceKind, String resourceId);
}
