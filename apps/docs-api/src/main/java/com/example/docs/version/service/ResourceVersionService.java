package com.example.docs.version.service;

import com.example.docs.exception.ResourceNotFoundException;
import com.example.docs.resource.document.ShareableResourceDoc;
import com.example.docs.version.document.ResourceVersionDoc;
import com.example.docs.version.model.response.VersionPageResponse;
import com.example.docs.version.model.response.VersionResponse;
import com.example.docs.version.repository.ResourceVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Content snapshots of documents and wiki pages. Callers authorize against the resource first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResourceVersionService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final ResourceVersionRepository versionRepository;

    /**
     * Records the resource's current name and content.
     */
    public Mono<ResourceVersionDoc> snapshot(ShareableResourceDoc resource, String savedBy) {
        ResourceVersionDoc version = ResourceVersionDoc.builder()
                .resourceKind(resource.kind())
                .resourceId(resource.getId())
                .workspaceId(resource.getWorkspaceId())
                .name(resource.getName())
                .descriptionHtml(resource.getDescriptionHtml())
                .ownedBy(savedBy)
                .build();

        return versionRepository.save(version)
                .doOnNext(saved -> log.debug("Saved version {} of {} {}",
                        saved.getId(), resource.kind(), resource.getId()));
    }

    public Mono<VersionPageResponse> page(ShareableResourceDoc resource, int offset, int limit) {
        if (offset < 0 || limit < 1 || limit > MAX_LIMIT) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "offset must be at least 0 and limit between 1 and " + MAX_LIMIT));
        }
        Mono<Long> total = versionRepository.countByResourceKindAndResourceId(resource.kind(), resource.getId());
        Mono<List<VersionResponse>> results = versionRepository
                .findByResourceKindAndResourceIdOrderByCreatedAtDesc(resource.kind(), resource.getId())
                .skip(offset)
                .take(limit)
                .map(VersionResponse::from)
                .collectList();

        return Mono.zip(results, total)
                .map(tuple -> new VersionPageResponse(
                        tuple.getT1(),
                        tuple.getT2(),
                        (long) offset + limit < tuple.getT2() ? offset + limit : null));
    }

    public Mono<ResourceVersionDoc> find(ShareableResourceDoc resource, String versionId) {
        return versionRepository.findByIdAndResourceKindAndResourceId(versionId, resource.kind(), resource.getId())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Version", versionId)));
    }
}
