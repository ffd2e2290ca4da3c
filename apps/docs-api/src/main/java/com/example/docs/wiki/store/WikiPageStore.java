package com.example.docs.wiki.store;

import com.example.docs.access.model.ResourceKind;
import com.example.docs.wiki.document.WikiPageDoc;
import com.example.docs.wiki.document.WikiPageShareDoc;
import com.example.docs.wiki.repository.WikiPageRepository;
import com.example.docs.wiki.repository.WikiPageShareRepository;
import com.example.docs.resource.store.ResourceStore;
import org.springframework.stereotype.Component;

@Component
public class WikiPageStore extends ResourceStore<WikiPageDoc, WikiPageShareDoc> {

    public WikiPageStore(WikiPageRepository resources, WikiPageShareRepository shares) {
        super(ResourceKind.WIKI_PAGE, resources, shares);
    }

    @Override
    public WikiPageDoc newResource() {
        return new WikiPageDoc();
    }

    @Override
    public WikiPageShareDoc newShare() {
        return new WikiPageShareDoc();
    }
}
