package com.example.docs.workspace.document;

import com.example.docs.access.model.WorkspaceRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Membership of a user in a workspace. Removal flips {@code active}; records are never deleted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "workspace_members")
@CompoundIndex(name = "workspace_member_idx", def = "{'workspaceId': 1, 'memberId': 1}")
public class WorkspaceMemberDoc {

    @Id
    private String id;

    private String workspaceId;

    private String memberId;

    private WorkspaceRole role;

    private boolean active;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
