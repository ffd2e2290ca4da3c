package com.example.docs.comment.model.response;

import com.example.docs.comment.document.ResourceCommentDoc;

import java.time.Instant;

public record CommentResponse(
        String id,
        String resourceId,
        String actorId,
        String parentId,
        String commentHtml,
        Instant editedAt,
        Instant createdAt,
        Instant updatedAt
) {
    public static CommentResponse from(ResourceCommentDoc doc) {
        return new CommentResponse(
                doc.getId(),
                doc.getResourceId(),
                doc.getActorId(),
                doc.getParentId(),
                doc.getCommentHtml(),
                doc.getEditedAt(),
                doc.getCreatedAt(),
                doc.getUpdatedAt());
    }
}
