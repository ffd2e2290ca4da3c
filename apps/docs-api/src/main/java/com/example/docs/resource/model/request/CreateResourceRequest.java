package com.example.docs.resource.model.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateResourceRequest(
        @NotBlank(message = "Name is required")
        @Size(max = 255, message = "Name must not exceed 255 characters")
        String name,

        String descriptionHtml,

        @Size(max = 64)
        String collectionId,

        @Size(max = 64)
        String parentId,

        Double sortOrder
) {}
