package com.example.docs.version.model.response;

import com.example.docs.version.document.ResourceVersionDoc;

import java.time.Instant;

/**
 * Version list entry, without content.
 */
public record VersionResponse(
        String id,
        String resourceId,
        String ownedBy,
        Instant createdAt
) {
    public static VersionResponse from(ResourceVersionDoc doc) {
        return new VersionResponse(doc.getId(), doc.getResourceId(), doc.getOwnedBy(), doc.getCreatedAt());
    }
}
