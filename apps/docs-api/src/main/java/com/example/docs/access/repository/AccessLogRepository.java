package com.example.docs.access.repository;

import com.example.docs.access.document.AccessLogDoc;
import com.example.docs.access.model.ResourceKind;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import reactor.core.publisher.Flux;

public interface AccessLogRepository extends ReactiveMongoRepository<AccessLogDoc, String> {

    Flux<AccessLogDoc> findByResourceKindAndResourceIdOrderByCreatedAtDesc(ResourceKind resourceKind, String resourceId);
}
