package com.example.docs.resource.model.response;

import com.example.docs.access.model.AccessLevel;
import com.example.docs.access.model.ResourceKind;
import com.example.docs.resource.document.ShareableResourceDoc;

import java.time.Instant;

public record ResourceResponse(
        String id,
        ResourceKind kind,
        String workspaceId,
        String collectionId,
        String parentId,
        String name,
        String descriptionHtml,
        AccessLevel access,
        String ownedBy,
        boolean isOwner,
        boolean locked,
        String lockedBy,
        Instant archivedAt,
        Double sortOrder,
        Instant createdAt,
        Instant updatedAt
) {
    public static ResourceResponse from(ShareableResourceDoc doc, String requesterId) {
        return new ResourceResponse(
                doc.getId(),
                doc.kind(),
                doc.getWorkspaceId(),
                doc.getCollectionId(),
                doc.getParentId(),
                doc.getName(),
                doc.getDescriptionHtml(),
                doc.getAccess(),
                doc.getOwnedBy(),
                doc.isOwnedBy(requesterId),
                doc.isLocked(),
                doc.getLockedBy(),
                doc.getArchivedAt(),
                doc.getSortOrder(),
                doc.getCreatedAt(),
                doc.getUpdatedAt());
    }
}
