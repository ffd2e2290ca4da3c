package com.example.docs.document.store;

import com.example.docs.access.model.ResourceKind;
import com.example.docs.document.document.DocumentDoc;
import com.example.docs.document.document.DocumentShareDoc;
import com.example.docs.document.repository.DocumentRepository;
import com.example.docs.document.repository.DocumentShareRepository;
import com.example.docs.resource.store.ResourceStore;
import org.springframework.stereotype.Component;

@Component
public class DocumentStore extends ResourceStore<DocumentDoc, DocumentShareDoc> {

    public DocumentStore(DocumentRepository resources, DocumentShareRepository shares) {
        super(ResourceKind.DOCUMENT, resources, shares);
    }

    @Override
    public DocumentDoc newResource() {
        return new DocumentDoc();
    }

    @Override
    public DocumentShareDoc newShare() {
        return new DocumentShareDoc();
    }
}
