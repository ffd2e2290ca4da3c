package com.example.docs.resource.repository;

import com.example.docs.resource.document.ShareableResourceDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.data.repository.NoRepositoryBean;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Queries common to document and wiki page repositories. All of them skip soft-deleted records.
 */
@NoRepositoryBean
public interface ShareableResourceRepository<R extends ShareableResourceDoc>
        extends ReactiveMongoRepository<R, String> {

    Mono<R> findByIdAndWorkspaceIdAndDeletedAtIsNull(String id, String workspaceId);

    Flux<R> findByWorkspaceIdAndDeletedAtIsNullOrderBySortOrderAscCreatedAtDesc(String workspaceId);

    Flux<R> findByParentIdAndDeletedAtIsNull(String parentId);

    Flux<R> findByWorkspaceIdAndCollectionIdAndDeletedAtIsNull(String workspaceId, String collectionId);
}
