package com.example.docs.wiki.repository;

import com.example.docs.wiki.document.WikiPageDoc;
import com.example.docs.resource.repository.ShareableResourceRepository;

public interface WikiPageRepository extends ShareableResourceRepository<WikiPageDoc> {
}
