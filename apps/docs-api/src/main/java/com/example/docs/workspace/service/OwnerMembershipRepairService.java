package com.example.docs.workspace.service;

import com.example.docs.access.model.WorkspaceRole;
import com.example.docs.common.util.StringSanitizer;
import com.example.docs.workspace.document.WorkspaceDoc;
import com.example.docs.workspace.document.WorkspaceMemberDoc;
import com.example.docs.workspace.repository.WorkspaceMemberRepository;
import com.example.docs.workspace.repository.WorkspaceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;

/**
 * Makes sure every workspace owner holds an active ADMIN membership in their workspace.
 *
 * <p>For each workspace: an owner with an active membership is left alone, an inactive record is
 * reactivated as ADMIN, and a missing record is created. Workspaces without an owner are skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OwnerMembershipRepairService {

    private final WorkspaceRepository workspaceRepository;
    private final WorkspaceMemberRepository memberRepository;

    public record RepairReport(int examined, int reactivated, int created, int skipped, boolean dryRun) {

        public int fixed() {
            return reactivated + created;
        }
    }

    private enum Outcome { OK, REACTIVATED, CREATED, SKIPPED }

    /**
     * @param dryRun        report without writing
     * @param workspaceSlug only repair this workspace, {@code null} for all
     */
    public Mono<RepairReport> repair(boolean dryRun, @Nullable String workspaceSlug) {
        Flux<WorkspaceDoc> workspaces = (workspaceSlug != null && !workspaceSlug.isBlank())
                ? workspaceRepository.findBySlug(workspaceSlug).flux()
                : workspaceRepository.findAll();

        return workspaces
                .concatMap(workspace -> repairWorkspace(workspace, dryRun))
                .collectList()
                .map(outcomes -> summarize(outcomes, dryRun))
                .doOnNext(report -> log.info(
                        "Owner membership repair {}: examined={}, reactivated={}, created={}, skipped={}",
                        dryRun ? "(dry run)" : "complete",
                        report.examined(), report.reactivated(), report.created(), report.skipped()));
    }

    private Mono<Outcome> repairWorkspace(WorkspaceDoc workspace, boolean dryRun) {
        if (workspace.getOwnerId() == null) {
            log.warn("Workspace {} has no owner, skipping", StringSanitizer.forLog(workspace.getSlug()));
            return Mono.just(Outcome.SKIPPED);
        }

        return memberRepository.findByWorkspaceIdAndMemberId(workspace.getId(), workspace.getOwnerId())
                .collectList()
                .flatMap(records -> {
                    if (records.stream().anyMatch(WorkspaceMemberDoc::isActive)) {
                        return Mono.just(Outcome.OK);
                    }
                    if (!records.isEmpty()) {
                        return reactivate(workspace, latest(records), dryRun);
                    }
                    return create(workspace, dryRun);
                });
    }

    private Mono<Outcome> reactivate(WorkspaceDoc workspace, WorkspaceMemberDoc record, boolean dryRun) {
        log.info("{}Reactivating owner {} in workspace {}",
                dryRun ? "[dry run] " : "", workspace.getOwnerId(), StringSanitizer.forLog(workspace.getSlug()));
        if (dryRun) {
            return Mono.just(Outcome.REACTIVATED);
        }
        record.setActive(true);
        record.setRole(WorkspaceRole.ADMIN);
        return memberRepository.save(record).thenReturn(Outcome.REACTIVATED);
    }

    private Mono<Outcome> create(WorkspaceDoc workspace, boolean dryRun) {
        log.info("{}Creating ADMIN membership for owner {} in workspace {}",
                dryRun ? "[dry run] " : "", workspace.getOwnerId(), StringSanitizer.forLog(workspace.getSlug()));
        if (dryRun) {
            return Mono.just(Outcome.CREATED);
        }
        WorkspaceMemberDoc member = WorkspaceMemberDoc.builder()
                .workspaceId(workspace.getId())
                .memberId(workspace.getOwnerId())
                .role(WorkspaceRole.ADMIN)
                .active(true)
                .build();
        return memberRepository.save(member).thenReturn(Outcome.CREATED);
    }

    private static WorkspaceMemberDoc latest(List<WorkspaceMemberDoc> records) {
        return records.stream()
                .max(Comparator.comparing(WorkspaceMemberDoc::getUpdatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .orElseThrow();
    }

    private static RepairReport summarize(List<Outcome> outcomes, boolean dryRun) {
        int reactivated = 0;
        int created = 0;
        int skipped = 0;
        for (Outcome outcome : outcomes) {
            switch (outcome) {
                case REACTIVATED -> reactivated++;
                case CREATED -> created++;
                case SKIPPED -> skipped++;
                default -> { }
            }
        }
        return new RepairReport(outcomes.size(), reactivated, created, skipped, dryRun);
    }
}
