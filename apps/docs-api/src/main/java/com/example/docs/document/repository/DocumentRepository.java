package com.example.docs.document.repository;

import com.example.docs.document.document.DocumentDoc;
import com.example.docs.resource.repository.ShareableResourceRepository;

public interface DocumentRepository extends ShareableResourceRepository<DocumentDoc> {
}
