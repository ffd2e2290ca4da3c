package com.example.docs.version.document;

import com.example.docs.access.model.ResourceKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Snapshot of a document's or wiki page's content at one save.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "resource_versions")
@CompoundIndex(name = "resource_created_idx", def = "{'resourceKind': 1, 'resourceId': 1, 'createdAt': -1}")
public class ResourceVersionDoc {

    @Id
    private String id;

    private ResourceKind resourceKind;

    private String resourceId;

    private String workspaceId;

    private String name;

    private String descriptionHtml;

    // User whose save produced the snapshot
    private String ownedBy;

    @CreatedDate
    private Instant createdAt;
}
