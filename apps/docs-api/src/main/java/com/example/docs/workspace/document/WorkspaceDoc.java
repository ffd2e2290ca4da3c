package com.example.docs.workspace.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Tenant boundary. Every document, wiki page and collection belongs to exactly one workspace.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "workspaces")
public class WorkspaceDoc {

    @Id
    private String id;

    @Indexed(unique = true)
    private String slug;

    private String name;

    /**
     * User id of the workspace owner.
     */
    @Indexed
    private String ownerId;

    @CreatedDate
    private Instant createdAt;
}
