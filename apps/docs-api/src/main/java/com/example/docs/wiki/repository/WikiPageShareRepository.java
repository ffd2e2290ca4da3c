package com.example.docs.wiki.repository;

import com.example.docs.wiki.document.WikiPageShareDoc;
import com.example.docs.resource.repository.ResourceShareRepository;

public interface WikiPageShareRepository extends ResourceShareRepository<WikiPageShareDoc> {
}
