package com.example.docs.workspace.service;

import com.example.docs.access.model.WorkspaceRole;
import com.example.docs.workspace.document.WorkspaceDoc;
import com.example.docs.workspace.document.WorkspaceMemberDoc;
import com.example.docs.workspace.repository.WorkspaceMemberRepository;
import com.example.docs.workspace.repository.WorkspaceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OwnerMembershipRepairService")
class OwnerMembershipRepairServiceTest {

    @Mock
    private WorkspaceRepository workspaceRepository;

    @Mock
    private WorkspaceMemberRepository memberRepository;

    private OwnerMembershipRepairService service;

    private final WorkspaceDoc healthy = workspace("ws-1", "healthy", "owner-1");
    private final WorkspaceDoc lapsed = workspace("ws-2", "lapsed", "owner-2");
    private final WorkspaceDoc missing = workspace("ws-3", "missing", "owner-3");
    private final WorkspaceDoc orphan = workspace("ws-4", "orphan", null);

    private final WorkspaceMemberDoc olderRecord = member("ws-2", "owner-2", "m-old", Instant.parse("2023-01-01T00:00:00Z"));
    private final WorkspaceMemberDoc newerRecord = member("ws-2", "owner-2", "m-new", Instant.parse("2024-01-01T00:00:00Z"));

    @BeforeEach
    void setUp() {
        service = new OwnerMembershipRepairService(workspaceRepository, memberRepository);
    }

    private static WorkspaceDoc workspace(String id, String slug, String ownerId) {
        return WorkspaceDoc.builder().id(id).slug(slug).name(slug).ownerId(ownerId).build();
    }

    private static WorkspaceMemberDoc member(String workspaceId, String memberId, String id, Instant updatedAt) {
        return WorkspaceMemberDoc.builder()
                .id(id)
                .workspaceId(workspaceId)
                .memberId(memberId)
                .role(WorkspaceRole.MEMBER)
                .active(false)
                .updatedAt(updatedAt)
                .build();
    }

    private void givenAllWorkspaces() {
        WorkspaceMemberDoc activeOwner = member("ws-1", "owner-1", "m-1", null);
        activeOwner.setActive(true);
        activeOwner.setRole(WorkspaceRole.ADMIN);

        when(workspaceRepository.findAll()).thenReturn(Flux.just(healthy, lapsed, missing, orphan));
        when(memberRepository.findByWorkspaceIdAndMemberId("ws-1", "owner-1")).thenReturn(Flux.just(activeOwner));
        when(memberRepository.findByWorkspaceIdAndMemberId("ws-2", "owner-2"))
                .thenReturn(Flux.just(olderRecord, newerRecord));
        when(memberRepository.findByWorkspaceIdAndMemberId("ws-3", "owner-3")).thenReturn(Flux.empty());
    }

    @Test
    @DisplayName("should reactivate lapsed owners and create missing memberships")
    void shouldRepairAllWorkspaces() {
        givenAllWorkspaces();
        when(memberRepository.save(any(WorkspaceMemberDoc.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        StepVerifier.create(service.repair(false, null))
                .assertNext(report -> {
                    assertThat(report.examined()).isEqualTo(4);
                    assertThat(report.reactivated()).isEqualTo(1);
                    assertThat(report.created()).isEqualTo(1);
                    assertThat(report.skipped()).isEqualTo(1);
                    assertThat(report.fixed()).isEqualTo(2);
                    assertThat(report.dryRun()).isFalse();
                })
                .verifyComplete();

        ArgumentCaptor<WorkspaceMemberDoc> saved = ArgumentCaptor.forClass(WorkspaceMemberDoc.class);
        verify(memberRepository, times(2)).save(saved.capture());
        List<WorkspaceMemberDoc> writes = saved.getAllValues();

        assertThat(writes.get(0)).isSameAs(newerRecord);
        assertThat(newerRecord.isActive()).isTrue();
        assertThat(newerRecord.getRole()).isEqualTo(WorkspaceRole.ADMIN);
        assertThat(olderRecord.isActive()).isFalse();

        assertThat(writes.get(1).getWorkspaceId()).isEqualTo("ws-3");
        assertThat(writes.get(1).getMemberId()).isEqualTo("owner-3");
        assertThat(writes.get(1).getRole()).isEqualTo(WorkspaceRole.ADMIN);
        assertThat(writes.get(1).isActive()).isTrue();
    }

    @Test
    @DisplayName("should report without writing on a dry run")
    void shouldNotWriteOnDryRun() {
        givenAllWorkspaces();

        StepVerifier.create(service.repair(true, null))
                .assertNext(report -> {
                    assertThat(report.fixed()).isEqualTo(2);
                    assertThat(report.dryRun()).isTrue();
                })
                .verifyComplete();

        verify(memberRepository, never()).save(any(WorkspaceMemberDoc.class));
        assertThat(newerRecord.isActive()).isFalse();
    }

    @Test
    @DisplayName("should limit the repair to one workspace when a slug is given")
    void shouldFilterBySlug() {
        when(workspaceRepository.findBySlug("missing")).thenReturn(Mono.just(missing));
        when(memberRepository.findByWorkspaceIdAndMemberId("ws-3", "owner-3")).thenReturn(Flux.empty());
        when(memberRepository.save(any(WorkspaceMemberDoc.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        StepVerifier.create(service.repair(false, "missing"))
                .assertNext(report -> {
                    assertThat(report.examined()).isEqualTo(1);
                    assertThat(report.created()).isEqualTo(1);
                })
                .verifyComplete();

        verify(workspaceRepository, never()).findAll();
    }
}
