package com.example.docs.document.controller;

import com.example.docs.access.model.ResourceKind;
import com.example.docs.collection.controller.CollectionController;
import com.example.docs.collection.service.CollectionService;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/workspaces/{slug}/documents/collections")
public class DocumentCollectionController extends CollectionController {

    public DocumentCollectionController(CollectionService collectionService) {
        super(collectionService, ResourceKind.DOCUMENT);
    }
}
