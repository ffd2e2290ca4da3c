package com.example.docs.resource.model.request;

import com.example.docs.access.model.SharePermission;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ShareRequest(
        @NotBlank(message = "userId is required")
        @Size(max = 128)
        String userId,

        SharePermission permission
) {
    public ShareRequest {
        if (permission == null) {
            permission = SharePermission.VIEW;
        }
    }
}
