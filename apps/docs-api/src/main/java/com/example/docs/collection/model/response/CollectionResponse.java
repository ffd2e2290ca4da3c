package com.example.docs.collection.model.response;

import com.example.docs.access.model.ResourceKind;
import com.example.docs.collection.document.CollectionDoc;

import java.time.Instant;

public record CollectionResponse(
        String id,
        ResourceKind kind,
        String workspaceId,
        String name,
        String description,
        String parentId,
        Double sortOrder,
        String createdBy,
        Instant createdAt,
        Instant updatedAt
) {
    public static CollectionResponse from(CollectionDoc doc) {
        return new CollectionResponse(
                doc.getId(),
                doc.getKind(),
                doc.getWorkspaceId(),
                doc.getName(),
                doc.getDescription(),
                doc.getParentId(),
                doc.getSortOrder(),
                doc.getCreatedBy(),
                doc.getCreatedAt(),
                doc.getUpdatedAt());
    }
}
