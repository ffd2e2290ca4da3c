package com.example.docs.comment.model.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdateCommentRequest(
        @NotBlank(message = "commentHtml is required")
        @Size(max = 100_000)
        String commentHtml
) {}
