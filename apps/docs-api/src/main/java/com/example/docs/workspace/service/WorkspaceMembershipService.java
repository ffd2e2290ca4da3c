package com.example.docs.workspace.service;

import com.example.docs.exception.ResourceNotFoundException;
import com.example.docs.workspace.document.WorkspaceMemberDoc;
import com.example.docs.workspace.model.WorkspaceMembership;
import com.example.docs.workspace.repository.WorkspaceMemberRepository;
import com.example.docs.workspace.repository.WorkspaceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Membership store. Every call hits the database; memberships are never cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkspaceMembershipService {

    private final WorkspaceRepository workspaceRepository;
    private final WorkspaceMemberRepository memberRepository;

    /**
     * Active membership of {@code userId} in the workspace {@code workspaceSlug}.
     * Empty when the workspace does not exist or the user has no active membership.
     */
    public Mono<WorkspaceMembership> findActiveMembership(String userId, String workspaceSlug) {
        return workspaceRepository.findBySlug(workspaceSlug)
                .flatMap(workspace -> memberRepository
                        .findFirstByWorkspaceIdAndMemberIdAndActiveTrue(workspace.getId(), userId)
                        .filter(member -> {
                            if (member.getRole() == null) {
                                log.warn("Membership {} has no role, treating as absent", member.getId());
                                return false;
                            }
                            return true;
                        })
                        .map(member -> new WorkspaceMembership(
                                workspace.getId(), workspace.getSlug(), member.getMemberId(), member.getRole())));
    }

    public Mono<Boolean> isActiveMember(String workspaceId, String userId) {
        return memberRepository.findFirstByWorkspaceIdAndMemberIdAndActiveTrue(workspaceId, userId)
                .hasElement();
    }

    public Flux<WorkspaceMemberDoc> listActiveMembers(String workspaceId) {
        return memberRepository.findByWorkspaceIdAndActiveTrueOrderByCreatedAtAsc(workspaceId);
    }

    /**
     * Deactivates the active membership of {@code memberId}. Errors with 404 when there is none.
     */
    public Mono<WorkspaceMemberDoc> deactivate(String workspaceId, String memberId) {
        return memberRepository.findFirstByWorkspaceIdAndMemberIdAndActiveTrue(workspaceId, memberId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Member", memberId)))
                .flatMap(member -> {
                    member.setActive(false);
                    return memberRepository.save(member);
                })
                .doOnNext(member -> log.info("Deactivated member {} in workspace {}",
                        member.getMemberId(), workspaceId));
    }
}
