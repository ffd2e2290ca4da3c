package com.example.docs.workspace.repository;

import com.example.docs.workspace.document.WorkspaceMemberDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface WorkspaceMemberRepository extends ReactiveMongoRepository<WorkspaceMemberDoc, String> {

    Mono<WorkspaceMemberDoc> findFirstByWorkspaceIdAndMemberIdAndActiveTrue(String workspaceId, String memberId);

    Flux<WorkspaceMemberDoc> findByWorkspaceIdAndMemberId(String workspaceId, String memberId);

    Flux<WorkspaceMemberDoc> findByWorkspaceIdAndActiveTrueOrderByCreatedAtAsc(String workspaceId);
}
