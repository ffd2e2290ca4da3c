package com.example.docs.version.model.response;

import com.example.docs.access.model.ResourceKind;
import com.example.docs.version.document.ResourceVersionDoc;

import java.time.Instant;

public record VersionDetailResponse(
        String id,
        ResourceKind resourceKind,
        String resourceId,
        String name,
        String descriptionHtml,
        String ownedBy,
        Instant createdAt
) {
    public static VersionDetailResponse from(ResourceVersionDoc doc) {
        return new VersionDetailResponse(
                doc.getId(),
                doc.getResourceKind(),
                doc.getResourceId(),
                doc.getName(),
                doc.getDescriptionHtml(),
                doc.getOwnedBy(),
                doc.getCreatedAt());
    }
}
