package com.example.docs.resource.model.request;

import com.example.docs.access.model.SharePermission;
import jakarta.validation.constraints.NotNull;

public record UpdateShareRequest(
        @NotNull(message = "permission is required")
        SharePermission permission
) {}
