package com.example.docs.resource.repository;

import com.example.docs.resource.document.ResourceShareDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.data.repository.NoRepositoryBean;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@NoRepositoryBean
public interface ResourceShareRepository<S extends ResourceShareDoc>
        extends ReactiveMongoRepository<S, String> {

    Mono<S> findFirstByResourceIdAndUserIdAndDeletedAtIsNull(String resourceId, String userId);

    Flux<S> findByResourceIdAndUserIdAndDeletedAtIsNull(String resourceId, String userId);

    Flux<S> findByResourceIdAndDeletedAtIsNullOrderByCreatedAtAsc(String resourceId);

    Flux<S> findByWorkspaceIdAndUserIdAndDeletedAtIsNull(String workspaceId, String userId);

    Mono<Long> countByResourceIdAndDeletedAtIsNull(String resourceId);
}
