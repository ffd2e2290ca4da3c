package com.example.docs.document.repository;

import com.example.docs.document.document.DocumentShareDoc;
import com.example.docs.resource.repository.ResourceShareRepository;

public interface DocumentShareRepository extends ResourceShareRepository<DocumentShareDoc> {
}
