package com.example.docs.workspace.model.response;

import com.example.docs.access.model.WorkspaceRole;
import com.example.docs.workspace.document.WorkspaceMemberDoc;

import java.time.Instant;

public record WorkspaceMemberResponse(
        String memberId,
        WorkspaceRole role,
        int roleCode,
        boolean active,
        Instant joinedAt
) {
    public static WorkspaceMemberResponse from(WorkspaceMemberDoc doc) {
        return new WorkspaceMemberResponse(
                doc.getMemberId(),
                doc.getRole(),
                doc.getRole() != null ? doc.getRole().code() : 0,
                doc.isActive(),
                doc.getCreatedAt());
    }
}
