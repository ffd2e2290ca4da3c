package com.example.docs.resource.model.response;

import com.example.docs.access.model.SharePermission;
import com.example.docs.resource.document.ResourceShareDoc;

import java.time.Instant;

public record ShareResponse(
        String id,
        String resourceId,
        String userId,
        SharePermission permission,
        String createdBy,
        Instant createdAt,
        Instant updatedAt
) {
    public static ShareResponse from(ResourceShareDoc doc) {
        return new ShareResponse(
                doc.getId(),
                doc.getResourceId(),
                doc.getUserId(),
                doc.getPermission(),
                doc.getCreatedBy(),
                doc.getCreatedAt(),
                doc.getUpdatedAt());
    }
}
