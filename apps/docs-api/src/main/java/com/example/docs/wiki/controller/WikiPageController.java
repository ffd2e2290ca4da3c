package com.example.docs.wiki.controller;

import com.example.docs.wiki.document.WikiPageDoc;
import com.example.docs.wiki.document.WikiPageShareDoc;
import com.example.docs.wiki.service.WikiPageService;
import com.example.docs.resource.controller.ShareableResourceController;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/workspaces/{slug}/wiki/pages")
public class WikiPageController extends ShareableResourceController<WikiPageDoc, WikiPageShareDoc> {

    public WikiPageController(WikiPageService service) {
        super(service);
    }
}
