package com.example.docs.comment.service;

import com.example.docs.comment.document.ResourceCommentDoc;
import com.example.docs.comment.repository.ResourceCommentRepository;
import com.example.docs.exception.ResourceNotFoundException;
import com.example.docs.resource.document.ShareableResourceDoc;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Comment persistence for documents and wiki pages. Who may comment, edit or delete is decided by
 * the resource services before they get here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResourceCommentService {

    private final ResourceCommentRepository commentRepository;

    public Flux<ResourceCommentDoc> list(ShareableResourceDoc resource) {
        return commentRepository.findByResourceKindAndResourceIdAndDeletedAtIsNullOrderByCreatedAtDesc(
                resource.kind(), resource.getId());
    }

    public Mono<ResourceCommentDoc> find(ShareableResourceDoc resource, String commentId) {
        return commentRepository.findByIdAndResourceKindAndResourceIdAndDeletedAtIsNull(
                        commentId, resource.kind(), resource.getId())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Comment", commentId)));
    }

    /**
     * Adds a comment, optionally as a reply. The replied-to comment must be live and on the same resource.
     */
    public Mono<ResourceCommentDoc> create(
            ShareableResourceDoc resource, String actorId, String commentHtml, String parentId) {

        String replyTo = parentId == null || parentId.isBlank() ? null : parentId;
        Mono<Void> parentCheck = replyTo == null
                ? Mono.empty()
                : commentRepository.findByIdAndResourceKindAndResourceIdAndDeletedAtIsNull(
                                replyTo, resource.kind(), resource.getId())
                        .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                                "Parent comment not found")))
                        .then();

        ResourceCommentDoc comment = ResourceCommentDoc.builder()
                .resourceKind(resource.kind())
                .resourceId(resource.getId())
                .workspaceId(resource.getWorkspaceId())
                .commentHtml(commentHtml)
                .actorId(actorId)
                .parentId(replyTo)
                .build();

        return parentCheck.then(Mono.defer(() -> commentRepository.save(comment)))
                .doOnNext(saved -> log.debug("Comment {} added to {} {}",
                        saved.getId(), resource.kind(), resource.getId()));
    }

    public Mono<ResourceCommentDoc> edit(ResourceCommentDoc comment, String commentHtml) {
        comment.setCommentHtml(commentHtml);
        comment.setEditedAt(Instant.now());
        return commentRepository.save(comment);
    }

    public Mono<ResourceCommentDoc> delete(ResourceCommentDoc comment) {
        comment.setDeletedAt(Instant.now());
        return commentRepository.save(comment);
    }
}
