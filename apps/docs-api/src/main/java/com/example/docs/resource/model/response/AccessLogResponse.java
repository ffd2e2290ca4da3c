package com.example.docs.resource.model.response;

import com.example.docs.access.document.AccessLogDoc;
import com.example.docs.access.model.AccessType;

import java.time.Instant;
import java.util.Map;

public record AccessLogResponse(
        String id,
        String userId,
        AccessType accessType,
        String ipAddress,
        String userAgent,
        Map<String, Object> metadata,
        Instant createdAt
) {
    public static AccessLogResponse from(AccessLogDoc doc) {
        return new AccessLogResponse(
                doc.getId(),
                doc.getUserId(),
                doc.getAccessType(),
                doc.getIpAddress(),
                doc.getUserAgent(),
                doc.getMetadata(),
                doc.getCreatedAt());
    }
}
