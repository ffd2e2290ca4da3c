package com.example.docs.wiki.service;

import com.example.docs.access.audit.AccessAuditService;
import com.example.docs.access.service.ResourceAuthorizationService;
import com.example.docs.collection.service.CollectionService;
import com.example.docs.comment.service.ResourceCommentService;
import com.example.docs.wiki.document.WikiPageDoc;
import com.example.docs.wiki.document.WikiPageShareDoc;
import com.example.docs.wiki.store.WikiPageStore;
import com.example.docs.resource.service.ShareableResourceService;
import com.example.docs.version.service.ResourceVersionService;
import com.example.docs.workspace.service.WorkspaceMembershipService;
import org.springframework.stereotype.Service;

@Service
public class WikiPageService extends ShareableResourceService<WikiPageDoc, WikiPageShareDoc> {

    public WikiPageService(
            WikiPageStore store,
            ResourceAuthorizationService authorizationService,
            AccessAuditService auditService,
            WorkspaceMembershipService membershipService,
            CollectionService collectionService,
            ResourceVersionService versionService,
            ResourceCommentService commentService) {
        super(store, authorizationService, auditService, membershipService, collectionService,
                versionService, commentService);
    }
}
