package com.example.docs.comment.service;

import com.example.docs.access.model.ResourceKind;
import com.example.docs.comment.document.ResourceCommentDoc;
import com.example.docs.comment.repository.ResourceCommentRepository;
import com.example.docs.document.document.DocumentDoc;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static com.example.docs.util.DocumentTestBuilder.aDocument;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResourceCommentService")
class ResourceCommentServiceTest {

    @Mock
    private ResourceCommentRepository commentRepository;

    private ResourceCommentService service;

    private final DocumentDoc document = aDocument().build();

    @BeforeEach
    void setUp() {
        service = new ResourceCommentService(commentRepository);
    }

    private void givenSavesEchoed() {
        when(commentRepository.save(any(ResourceCommentDoc.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
    }

    @Test
    @DisplayName("create should attach the comment to the resource and its author")
    void shouldCreate() {
        givenSavesEchoed();

        StepVerifier.create(service.create(document, "user-2", "<p>hi</p>", "  "))
                .assertNext(comment -> {
                    assertThat(comment.getResourceKind()).isEqualTo(ResourceKind.DOCUMENT);
                    assertThat(comment.getResourceId()).isEqualTo("doc-1");
                    assertThat(comment.getActorId()).isEqualTo("user-2");
                    assertThat(comment.getParentId()).isNull();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("create should reject a reply to a comment that is not on the resource")
    void shouldRejectUnknownParent() {
        when(commentRepository.findByIdAndResourceKindAndResourceIdAndDeletedAtIsNull(
                "comment-9", ResourceKind.DOCUMENT, "doc-1"))
                .thenReturn(Mono.empty());

        StepVerifier.create(service.create(document, "user-2", "<p>hi</p>", "comment-9"))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ResponseStatusException.class);
                    assertThat(((ResponseStatusException) error).getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                })
                .verify();

        verify(commentRepository, never()).save(any(ResourceCommentDoc.class));
    }

    @Test
    @DisplayName("edit should stamp the edit time")
    void shouldStampEdit() {
        ResourceCommentDoc comment = ResourceCommentDoc.builder().id("comment-1").commentHtml("<p>old</p>").build();
        givenSavesEchoed();

        StepVerifier.create(service.edit(comment, "<p>new</p>"))
                .assertNext(saved -> {
                    assertThat(saved.getCommentHtml()).isEqualTo("<p>new</p>");
                    assertThat(saved.getEditedAt()).isNotNull();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("delete should be soft")
    void shouldSoftDelete() {
        ResourceCommentDoc comment = ResourceCommentDoc.builder().id("comment-1").build();
        givenSavesEchoed();

        StepVerifier.create(service.delete(comment))
                .assertNext(saved -> assertThat(saved.getDeletedAt()).isNotNull())
                .verifyComplete();

        verify(commentRepository, never()).delete(any(ResourceCommentDoc.class));
    }
}
