package com.example.docs.document.service;

import com.example.docs.access.audit.AccessAuditService;
import com.example.docs.access.service.ResourceAuthorizationService;
import com.example.docs.collection.service.CollectionService;
import com.example.docs.comment.service.ResourceCommentService;
import com.example.docs.document.document.DocumentDoc;
import com.example.docs.document.document.DocumentShareDoc;
import com.example.docs.document.store.DocumentStore;
import com.example.docs.resource.service.ShareableResourceService;
import com.example.docs.version.service.ResourceVersionService;
import com.example.docs.workspace.service.WorkspaceMembershipService;
import org.springframework.stereotype.Service;

@Service
public class DocumentService extends ShareableResourceService<DocumentDoc, DocumentShareDoc> {

    public DocumentService(
            DocumentStore store,
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
