package com.example.docs.collection.model.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateCollectionRequest(
        @NotBlank(message = "Name is required")
        @Size(max = 255, message = "Name must not exceed 255 characters")
        String name,

        @Size(max = 2000)
        String description,

        @Size(max = 64)
        String parentId,

        Double sortOrder
) {}
