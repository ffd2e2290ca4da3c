package com.example.docs.wiki.document;

import com.example.docs.access.model.ResourceKind;
import com.example.docs.resource.document.ShareableResourceDoc;
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
@Document(collection = "wiki_pages")
@CompoundIndexes({
        @CompoundIndex(name = "workspace_live_idx", def = "{'workspaceId': 1, 'deletedAt': 1, 'sortOrder': 1}"),
        @CompoundIndex(name = "parent_idx", def = "{'parentId': 1, 'deletedAt': 1}")
})
public class WikiPageDoc extends ShareableResourceDoc {

    @Override
    public ResourceKind kind() {
        return ResourceKind.WIKI_PAGE;
    }
}
