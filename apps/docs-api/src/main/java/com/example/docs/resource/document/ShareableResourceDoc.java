package com.example.docs.resource.document;

import com.example.docs.access.model.AccessLevel;
import com.example.docs.access.model.ShareableResource;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;

import java.time.Instant;

/**
 * Fields shared by documents and wiki pages. Each subclass maps to its own Mongo collection.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public abstract class ShareableResourceDoc implements ShareableResource {

    public static final double DEFAULT_SORT_ORDER = 65535;

    @Id
    private String id;

    private String workspaceId;

    private String collectionId;

    private String parentId;

    private String name;

    private String descriptionHtml;

    private AccessLevel access;

    private String ownedBy;

    /**
     * Advisory edit lock. Never consulted by access checks.
     */
    private boolean locked;

    private String lockedBy;

    private Instant archivedAt;

    private Double sortOrder;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    private Instant deletedAt;

    public boolean isArchived() {
        return archivedAt != null;
    }

    public boolean isOwnedBy(String userId) {
        return ownedBy != null && ownedBy.equals(userId);
    }
}
