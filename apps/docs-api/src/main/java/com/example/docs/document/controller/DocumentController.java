package com.example.docs.document.controller;

import com.example.docs.document.document.DocumentDoc;
import com.example.docs.document.document.DocumentShareDoc;
import com.example.docs.document.service.DocumentService;
import com.example.docs.resource.controller.ShareableResourceController;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/workspaces/{slug}/documents")
public class DocumentController extends ShareableResourceController<DocumentDoc, DocumentShareDoc> {

    public DocumentController(DocumentService service) {
        super(service);
    }
}
