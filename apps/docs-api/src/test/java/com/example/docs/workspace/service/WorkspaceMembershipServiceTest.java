package com.example.docs.workspace.service;

import com.example.docs.access.model.WorkspaceRole;
import com.example.docs.exception.ResourceNotFoundException;
import com.example.docs.workspace.document.WorkspaceDoc;
import com.example.docs.workspace.document.WorkspaceMemberDoc;
import com.example.docs.workspace.repository.WorkspaceMemberRepository;
import com.example.docs.workspace.repository.WorkspaceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static com.example.docs.util.MembershipTestBuilder.WORKSPACE_ID;
import static com.example.docs.util.MembershipTestBuilder.WORKSPACE_SLUG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("WorkspaceMembershipService")
class WorkspaceMembershipServiceTest {

    @Mock
    private WorkspaceRepository workspaceRepository;

    @Mock
    private WorkspaceMemberRepository memberRepository;

    private WorkspaceMembershipService service;

    @BeforeEach
    void setUp() {
        service = new WorkspaceMembershipService(workspaceRepository, memberRepository);
    }

    private static WorkspaceDoc workspace() {
        return WorkspaceDoc.builder().id(WORKSPACE_ID).slug(WORKSPACE_SLUG).name("Acme").ownerId("owner-1").build();
    }

    private static WorkspaceMemberDoc member(String memberId, WorkspaceRole role) {
        return WorkspaceMemberDoc.builder()
                .id("m-" + memberId)
                .workspaceId(WORKSPACE_ID)
                .memberId(memberId)
                .role(role)
                .active(true)
                .build();
    }

    @Nested
    @DisplayName("findActiveMembership")
    class FindActiveMembership {

        @Test
        @DisplayName("should resolve the slug and return the member's role")
        void shouldReturnMembership() {
            when(workspaceRepository.findBySlug(WORKSPACE_SLUG)).thenReturn(Mono.just(workspace()));
            when(memberRepository.findFirstByWorkspaceIdAndMemberIdAndActiveTrue(WORKSPACE_ID, "user-1"))
                    .thenReturn(Mono.just(member("user-1", WorkspaceRole.ADMIN)));

            StepVerifier.create(service.findActiveMembership("user-1", WORKSPACE_SLUG))
                    .assertNext(membership -> {
                        assertThat(membership.workspaceId()).isEqualTo(WORKSPACE_ID);
                        assertThat(membership.workspaceSlug()).isEqualTo(WORKSPACE_SLUG);
                        assertThat(membership.isAdmin()).isTrue();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should be empty for an unknown workspace")
        void shouldBeEmptyForUnknownWorkspace() {
            when(workspaceRepository.findBySlug("ghost")).thenReturn(Mono.empty());

            StepVerifier.create(service.findActiveMembership("user-1", "ghost"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should treat a membership without a role as absent")
        void shouldIgnoreRolelessMembership() {
            when(workspaceRepository.findBySlug(WORKSPACE_SLUG)).thenReturn(Mono.just(workspace()));
            when(memberRepository.findFirstByWorkspaceIdAndMemberIdAndActiveTrue(WORKSPACE_ID, "user-1"))
                    .thenReturn(Mono.just(member("user-1", null)));

            StepVerifier.create(service.findActiveMembership("user-1", WORKSPACE_SLUG))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("deactivate")
    class Deactivate {

        @Test
        @DisplayName("should flip the active flag and keep the record")
        void shouldDeactivate() {
            when(memberRepository.findFirstByWorkspaceIdAndMemberIdAndActiveTrue(WORKSPACE_ID, "user-2"))
                    .thenReturn(Mono.just(member("user-2", WorkspaceRole.MEMBER)));
            when(memberRepository.save(any(WorkspaceMemberDoc.class)))
                    .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

            StepVerifier.create(service.deactivate(WORKSPACE_ID, "user-2"))
                    .assertNext(saved -> assertThat(saved.isActive()).isFalse())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should report 404 when there is no active membership")
        void shouldRejectMissingMember() {
            when(memberRepository.findFirstByWorkspaceIdAndMemberIdAndActiveTrue(WORKSPACE_ID, "user-9"))
                    .thenReturn(Mono.empty());

            StepVerifier.create(service.deactivate(WORKSPACE_ID, "user-9"))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }
}
