package com.example.docs.wiki.controller;

import com.example.docs.access.model.ResourceKind;
import com.example.docs.collection.controller.CollectionController;
import com.example.docs.collection.service.CollectionService;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/workspaces/{slug}/wiki/collections")
public class WikiCollectionController extends CollectionController {

    public WikiCollectionController(CollectionService collectionService) {
        super(collectionService, ResourceKind.WIKI_PAGE);
    }
}
