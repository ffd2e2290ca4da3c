package com.example.docs.workspace.model;

import com.example.docs.access.model.WorkspaceRole;

/**
 * An active membership, resolved for one request.
 */
public record WorkspaceMembership(
        String workspaceId,
        String workspaceSlug,
        String userId,
        WorkspaceRole role
) {
    public boolean isAdmin() {
        return role.isAdmin();
    }
}
