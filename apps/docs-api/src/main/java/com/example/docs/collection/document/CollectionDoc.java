package com.example.docs.collection.document;

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
 * Folder for documents or wiki pages. Both kinds live in one Mongo collection, told apart by {@code kind}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "collections")
@CompoundIndex(name = "workspace_kind_idx", def = "{'workspaceId': 1, 'kind': 1, 'deletedAt': 1}")
public class CollectionDoc {

    @Id
    private String id;

    private String workspaceId;

    private ResourceKind kind;

    private String name;

    private String description;

    private String parentId;

    private Double sortOrder;

    private String createdBy;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    private Instant deletedAt;
}
