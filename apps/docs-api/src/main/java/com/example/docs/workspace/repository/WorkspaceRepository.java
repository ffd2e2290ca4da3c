package com.example.docs.workspace.repository;

import com.example.docs.workspace.document.WorkspaceDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import reactor.core.publisher.Mono;

public interface WorkspaceRepository extends ReactiveMongoRepository<WorkspaceDoc, String> {

    Mono<WorkspaceDoc> findBySlug(String slug);
}
