package com.example.docs.resource.document;

import com.example.docs.access.model.SharePermission;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Grant of a permission tier on one resource to one user. Revoked shares keep their record
 * with {@code deletedAt} set. At most one live share exists per resource and user.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public abstract class ResourceShareDoc {

    @Id
    private String id;

    private String resourceId;

    private String userId;

    private String workspaceId;

    private SharePermission permission;

    private String createdBy;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    // Written as an explicit null so the unique partial index on live shares can match it
    @Field(write = Field.Write.ALWAYS)
    private Instant deletedAt;

    public boolean isActive() {
        return deletedAt == null;
    }
}
