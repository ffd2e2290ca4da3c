package com.example.docs.wiki.document;

import com.example.docs.resource.document.ResourceShareDoc;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@Document(collection = "wiki_page_shares")
@CompoundIndexes({
        @CompoundIndex(name = "resource_user_idx", def = "{'resourceId': 1, 'userId': 1}", unique = true,
                partialFilter = "{'deletedAt': {'$type': 'null'}}"),
        @CompoundIndex(name = "workspace_user_idx", def = "{'workspaceId': 1, 'userId': 1, 'deletedAt': 1}")
})
public class WikiPageShareDoc extends ResourceShareDoc {
}
