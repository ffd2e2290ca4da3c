package com.example.docs.resource.model.request;

import com.example.docs.access.model.AccessLevel;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update. {@code null} leaves a field unchanged; an empty string clears
 * {@code collectionId} or {@code parentId}.
 */
public record UpdateResourceRequest(
        @Size(max = 255, message = "Name must not exceed 255 characters")
        @Pattern(regexp = ".*\\S.*", message = "Name must not be blank")
        String name,

        String descriptionHtml,

        @Size(max = 64)
        String collectionId,

        @Size(max = 64)
        String parentId,

        AccessLevel access,

        Double sortOrder
) {}
