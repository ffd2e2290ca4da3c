package com.example.docs.collection.model.request;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

// null leaves a field unchanged, an empty parentId moves the collection to the top level
public record UpdateCollectionRequest(
        @Size(max = 255, message = "Name must not exceed 255 characters")
        @Pattern(regexp = ".*\\S.*", message = "Name must not be blank")
        String name,

        @Size(max = 2000)
        String description,

        @Size(max = 64)
        String parentId,

        Double sortOrder
) {}
