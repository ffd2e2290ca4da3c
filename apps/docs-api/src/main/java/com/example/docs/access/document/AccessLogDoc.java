package com.example.docs.access.document;

import com.example.docs.access.model.AccessType;
import com.example.docs.access.model.ResourceKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Audit record of an access to a document or wiki page.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "access_logs")
@CompoundIndexes({
        @CompoundIndex(name = "resource_date_idx", def = "{'resourceKind': 1, 'resourceId': 1, 'createdAt': -1}"),
        @CompoundIndex(name = "user_date_idx", def = "{'userId': 1, 'createdAt': -1}"),
        @CompoundIndex(name = "workspace_type_idx", def = "{'workspaceId': 1, 'accessType': 1}")
})
public class AccessLogDoc {

    @Id
    private String id;

    private ResourceKind resourceKind;

    private String resourceId;

    private String workspaceId;

    private String userId;

    private AccessType accessType;

    private String ipAddress;

    private String userAgent;

    private Map<String, Object> metadata;

    @CreatedDate
    private Instant createdAt;
}
