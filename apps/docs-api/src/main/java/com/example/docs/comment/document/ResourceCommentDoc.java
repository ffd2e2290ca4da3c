package com.example.docs.comment.document;

import com.example.docs.access.model.ResourceKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Comment on a document or wiki page. {@code parentId} points at the comment being replied to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "resource_comments")
@CompoundIndex(name = "resource_live_idx", def = "{'resourceKind': 1, 'resourceId': 1, 'deletedAt': 1, 'createdAt': -1}")
public class ResourceCommentDoc {

    @Id
    private String id;

    private ResourceKind resourceKind;

    private String resourceId;

    private String workspaceId;

    private String commentHtml;

    private String actorId;

    private String parentId;

    private Instant editedAt;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    private Instant deletedAt;

    public boolean isAuthoredBy(String userId) {
        return actorId != null && actorId.equals(userId);
    }
}
